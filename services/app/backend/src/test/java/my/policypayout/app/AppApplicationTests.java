package my.policypayout.app;

import my.policypayout.app.service.PayoutTableService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {
	@Autowired
	private PayoutTableService tableService;

	@Test
	void contextLoadsWithDefaultTable() {
		assertThat(tableService.current().size()).isGreaterThan(0);
	}
}
