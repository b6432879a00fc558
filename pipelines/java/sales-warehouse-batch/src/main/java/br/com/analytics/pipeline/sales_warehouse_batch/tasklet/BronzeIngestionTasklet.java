package br.com.analytics.pipeline.sales_warehouse_batch.tasklet;

import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.BronzeTableLoader;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.DelimitedSourceReader;
import br.com.analytics.pipeline.sales_warehouse_batch.ingestion.RawSourceTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class BronzeIngestionTasklet implements Tasklet {

    private final DelimitedSourceReader sourceReader;
    private final BronzeTableLoader tableLoader;
    private final Path sourceRoot;

    public BronzeIngestionTasklet(DelimitedSourceReader sourceReader, BronzeTableLoader tableLoader, Path sourceRoot) {
        this.sourceReader = sourceReader;
        this.tableLoader = tableLoader;
        this.sourceRoot = sourceRoot;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        long started = System.nanoTime();
        log.info("[bronze] Loading source extracts from {}", sourceRoot);

        Map<RawSourceTable, List<Object[]>> rowsByTable = new EnumMap<>(RawSourceTable.class);
        for (RawSourceTable source : RawSourceTable.values()) {
            Path file = source.resolve(sourceRoot);
            rowsByTable.put(source, sourceReader.read(source, file));
            log.info("[bronze] Read {} records from {}", rowsByTable.get(source).size(), file);
        }

        Map<RawSourceTable, Integer> counts = tableLoader.replaceAll(rowsByTable);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("[bronze] {} tables loaded in {} ms", counts.size(), elapsed.toMillis());
        return RepeatStatus.FINISHED;
    }
}
