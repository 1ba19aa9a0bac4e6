package my.policypayout.app.classify;

public record PayinClassification(double value, PayinBracket bracket) {
	public static final PayinClassification DEFAULT = new PayinClassification(0.0d, PayinBracket.BELOW_20);
}
