package my.policypayout.app.service;

import jakarta.annotation.PreDestroy;
import my.policypayout.app.config.AppProperties;
import my.policypayout.app.dto.PayoutBatchResultDto;
import my.policypayout.app.dto.PayoutRowDto;
import my.policypayout.app.dto.PayoutSummaryDto;
import my.policypayout.app.rules.PayoutRulesEngine;
import my.policypayout.app.rules.PayoutTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

@Service
public class PayoutBatchService {
	private static final Logger logger = LoggerFactory.getLogger(PayoutBatchService.class);
	private static final int DEFAULT_PARALLEL_THRESHOLD = 64;

	private final PayoutTableService tableService;
	private final PayoutResultAssembler assembler;
	private final int parallelThreshold;
	private final ExecutorService executor;

	public PayoutBatchService(PayoutTableService tableService, AppProperties properties) {
		this.tableService = tableService;
		this.assembler = new PayoutResultAssembler();
		AppProperties.Payout payout = properties == null ? null : properties.payout();
		int workers = payout == null || payout.workerThreads() == null ? 1 : payout.workerThreads();
		this.parallelThreshold = payout == null || payout.parallelThreshold() == null
				? DEFAULT_PARALLEL_THRESHOLD
				: payout.parallelThreshold();
		this.executor = workers > 1 ? Executors.newFixedThreadPool(workers) : null;
	}

	public PayoutBatchResultDto process(List<Map<String, Object>> records, String companyName) {
		if (records == null || records.isEmpty()) {
			throw new EmptyBatchException("No policy data found");
		}
		if (companyName == null || companyName.isBlank()) {
			throw new EmptyBatchException("companyName is required");
		}
		PayoutTable snapshot = tableService.current();
		PayoutRulesEngine engine = new PayoutRulesEngine(snapshot);
		logger.info("Processing {} records for {} against payout table '{}'", records.size(), companyName, snapshot.name());

		List<PayoutOutcome> outcomes = executor != null && records.size() >= parallelThreshold
				? processParallel(records, companyName, engine)
				: processSequential(records, companyName, engine);

		long failed = outcomes.stream().filter(PayoutOutcome::failed).count();
		logger.info("Calculated {} records ({} failed)", outcomes.size(), failed);
		List<PayoutRowDto> rows = outcomes.stream().map(PayoutOutcome::row).toList();
		return new PayoutBatchResultDto(snapshot.name(), rows, summarize(outcomes, companyName));
	}

	private List<PayoutOutcome> processSequential(List<Map<String, Object>> records, String companyName,
												  PayoutRulesEngine engine) {
		List<PayoutOutcome> outcomes = new ArrayList<>(records.size());
		for (Map<String, Object> record : records) {
			outcomes.add(assembler.assemble(record, companyName, engine));
		}
		return outcomes;
	}

	private List<PayoutOutcome> processParallel(List<Map<String, Object>> records, String companyName,
												PayoutRulesEngine engine) {
		List<Callable<PayoutOutcome>> tasks = new ArrayList<>(records.size());
		for (Map<String, Object> record : records) {
			tasks.add(() -> assembler.assemble(record, companyName, engine));
		}
		try {
			List<PayoutOutcome> outcomes = new ArrayList<>(records.size());
			for (Future<PayoutOutcome> future : executor.invokeAll(tasks)) {
				outcomes.add(future.get());
			}
			return outcomes;
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Payout batch interrupted", ex);
		} catch (ExecutionException ex) {
			throw new IllegalStateException("Payout batch failed: " + ex.getCause().getMessage(), ex.getCause());
		}
	}

	PayoutSummaryDto summarize(List<PayoutOutcome> outcomes, String companyName) {
		double totalPayin = 0.0d;
		Set<String> segments = new HashSet<>();
		Map<String, Integer> formulaSummary = new LinkedHashMap<>();
		for (PayoutOutcome outcome : outcomes) {
			totalPayin += outcome.payinValue();
			segments.add(outcome.resolvedSegment() == null ? "" : outcome.resolvedSegment());
			formulaSummary.merge(outcome.row().formulaUsed(), 1, Integer::sum);
		}
		double avg = outcomes.isEmpty() ? 0.0d : totalPayin / outcomes.size();
		return new PayoutSummaryDto(
				outcomes.size(),
				Math.round(avg * 10.0d) / 10.0d,
				segments.size(),
				companyName,
				formulaSummary
		);
	}

	@PreDestroy
	public void shutdown() {
		if (executor != null) {
			executor.shutdownNow();
		}
	}
}
