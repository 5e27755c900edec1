package org.catalogapi.export.pipeline.exporter;

import java.util.List;
import java.util.Map;

import org.catalogapi.export.pipeline.ir.DeletionRecord;
import org.catalogapi.export.pipeline.status.ExportJob;
import org.catalogapi.export.pipeline.status.ExportStatus;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs one export job in this process: fetch, export record chunks, delete deletion chunks,
 * compile, final callback, final status.
 *
 * A failure while fetching ends the job with status error and no final callback; so does an
 * unexpected failure while compiling or in the final callback itself. A failing chunk
 * is logged against the job and skipped; the job then finishes as done_with_errors. The final
 * callback runs exactly once for every job that gets past fetching.
 */
@Slf4j
public class ExportJobRunner {
    static final String FETCH_STAGE = "fetch";
    static final String RECORD_CHUNK_STAGE = "record chunk";
    static final String DELETION_CHUNK_STAGE = "deletion chunk";
    static final String FINISH_STAGE = "finish";

    private record Work<R>(List<R> records, List<DeletionRecord> deletions) {}

    public <R> Mono<ExportResult> run(Exporter<R> exporter) {
        var job = exporter.getJob();
        return Mono.fromCallable(() -> {
                job.updateStatus(ExportStatus.RUNNING);
                return new Work<>(exporter.getRecords(), exporter.getDeletions());
            })
            .onErrorResume(e -> abort(job, FETCH_STAGE, e))
            .flatMap(work -> process(exporter, job, work)
                .onErrorResume(e -> abort(job, FINISH_STAGE, e)))
            .defaultIfEmpty(new ExportResult(ExportStatus.ERROR, Map.of()));
    }

    private static <T> Mono<T> abort(ExportJob job, String stage, Throwable e) {
        job.logError(null, stage, e.getMessage(), e);
        job.updateStatus(ExportStatus.ERROR);
        return Mono.empty();
    }

    private <R> Mono<ExportResult> process(Exporter<R> exporter, ExportJob job, Work<R> work) {
        log.atInfo().setMessage("Export #{}: {} records in chunks of {}, {} deletions in chunks of {}")
            .addArgument(job::getInstanceId)
            .addArgument(work.records()::size)
            .addArgument(job::getMaxRecordChunk)
            .addArgument(work.deletions()::size)
            .addArgument(job::getMaxDeletionChunk)
            .log();

        var recordResults = Flux.fromIterable(work.records())
            .buffer(job.getMaxRecordChunk())
            .concatMap(chunk -> Mono.fromCallable(() -> exporter.exportRecords(chunk))
                .onErrorResume(e -> chunkFailed(job, RECORD_CHUNK_STAGE, chunk.size(), e)));
        var deletionResults = Flux.fromIterable(work.deletions())
            .buffer(job.getMaxDeletionChunk())
            .concatMap(chunk -> Mono.fromCallable(() -> exporter.deleteRecords(chunk))
                .onErrorResume(e -> chunkFailed(job, DELETION_CHUNK_STAGE, chunk.size(), e)));

        return recordResults.concatWith(deletionResults)
            .collectList()
            .map(results -> finish(exporter, job, results));
    }

    private static Mono<Map<String, Object>> chunkFailed(ExportJob job, String stage, int size, Throwable e) {
        job.logError(null, stage, "Chunk of " + size + " failed: " + e.getMessage(), e);
        return Mono.empty();
    }

    private <R> ExportResult finish(Exporter<R> exporter, ExportJob job, List<Map<String, Object>> results) {
        var vals = exporter.compileVals(results);
        var status = job.getErrors() > 0 ? ExportStatus.DONE_WITH_ERRORS : ExportStatus.SUCCESS;
        exporter.finalCallback(vals, status);
        if (job.getErrors() > 0) {
            status = ExportStatus.DONE_WITH_ERRORS;
        }
        job.updateStatus(status);
        return new ExportResult(status, vals);
    }
}
