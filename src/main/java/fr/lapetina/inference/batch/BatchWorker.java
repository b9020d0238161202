package fr.lapetina.inference.batch;

import fr.lapetina.inference.compiler.CompiledModel;
import fr.lapetina.inference.compiler.ModelCompilationException;
import fr.lapetina.inference.compiler.QuantizationProfile;
import fr.lapetina.inference.device.DeviceManager;
import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Job;
import fr.lapetina.inference.domain.model.Module;
import fr.lapetina.inference.domain.model.NetworkResult;
import fr.lapetina.inference.domain.model.RunResult;
import fr.lapetina.inference.domain.model.Tensor;
import fr.lapetina.inference.infrastructure.config.RunnerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sequential pipeline run by one worker thread over its chunks:
 * load and preprocess, compile on the first chunk, run, report.
 *
 * The worker owns its compiled model and its device; nothing here is shared
 * with other workers except the aggregator. The device is stopped on every
 * exit path.
 *
 * A run that exceeds the run timeout halts the device: the hung run keeps
 * its queue, so every later chunk of this worker is reported as failed
 * without being run.
 */
public final class BatchWorker implements Callable<WorkerResult> {

    private static final Logger log = LoggerFactory.getLogger(BatchWorker.class);

    private final int workerId;
    private final BatchSource source;
    private final WorkerEnvironment env;
    private boolean deviceHalted;

    public BatchWorker(int workerId, BatchSource source, WorkerEnvironment env) {
        this.workerId = workerId;
        this.source = source;
        this.env = env;
    }

    @Override
    public WorkerResult call() throws IOException, ModelCompilationException {
        RunnerConfig.BatchConfig config = env.batchConfig();
        MDC.put("worker", String.valueOf(workerId));

        DeviceManager device = null;
        CompiledModel model = null;
        QuantizationProfile profile = config.isProfiling() ? new QuantizationProfile() : null;
        int chunks = 0;
        int jobs = 0;
        int failedChunks = 0;
        int compilations = 0;

        try {
            Optional<List<Job>> next;
            while ((next = source.nextChunk()).isPresent()) {
                List<Job> chunk = next.get();
                if (deviceHalted) {
                    env.aggregator().report(
                            env.reporter().reportFailure(chunk, "device halted after a run timed out").lines(),
                            chunk.size());
                    failedChunks++;
                    chunks++;
                    jobs += chunk.size();
                    continue;
                }

                Tensor input = env.preprocessor().loadAndPreprocess(
                        chunk.stream().map(Job::descriptor).toList());

                if (model == null) {
                    model = env.compiler().compile(env.networkName(), input.getType());
                    compilations++;

                    if (config.isEmitBundle()) {
                        env.compiler().emitBundle(model, Path.of(config.getBundlePath()));
                        return new WorkerResult(workerId, chunks, jobs, failedChunks, compilations);
                    }

                    device = env.deviceProvider().apply("device-" + workerId);
                    MDC.put("device", device.getName());
                    loadNetwork(device, model);
                }

                ExecutionContext context = new ExecutionContext().bind(model.inputName(), input);
                ClassificationReporter.ChunkReport report = runChunk(device, model, context, chunk, profile);
                if (report.failed()) {
                    failedChunks++;
                }
                env.aggregator().report(report.lines(), report.mismatches());

                chunks++;
                jobs += chunk.size();
            }

            if (profile != null) {
                profile.writeTo(Path.of(config.getProfilePath()));
            }

            log.info("Worker finished: worker={}, chunks={}, jobs={}, failedChunks={}",
                    workerId, chunks, jobs, failedChunks);
            return new WorkerResult(workerId, chunks, jobs, failedChunks, compilations);
        } finally {
            if (device != null && !deviceHalted) {
                device.stop(true);
            }
            MDC.remove("device");
            MDC.remove("worker");
        }
    }

    private void loadNetwork(DeviceManager device, CompiledModel model) {
        CompletableFuture<NetworkResult> ready = new CompletableFuture<>();
        device.addNetwork(new Module(model.networkName()), Map.of(model.networkName(), model.function()),
                ready::complete);

        NetworkResult result;
        try {
            result = await(ready);
        } catch (TimeoutException e) {
            deviceHalted = true;
            device.halt();
            throw new BatchExecutionException("Timed out loading network " + model.networkName(), e);
        }
        if (result.isError()) {
            throw new BatchExecutionException("Failed to load network " + model.networkName()
                    + " on " + device.getName() + ": " + result.errorType() + " " + result.errorMessage());
        }
    }

    private ClassificationReporter.ChunkReport runChunk(
            DeviceManager device,
            CompiledModel model,
            ExecutionContext context,
            List<Job> chunk,
            QuantizationProfile profile
    ) {
        CompletableFuture<RunResult> done = new CompletableFuture<>();
        long runId = device.runFunction(model.networkName(), context, done::complete).value();

        RunResult result;
        try {
            result = await(done);
        } catch (TimeoutException e) {
            log.warn("Run timed out, halting device: worker={}, device={}, runId={}, timeoutMs={}",
                    workerId, device.getName(), runId, env.batchConfig().getRunTimeoutMs());
            deviceHalted = true;
            device.halt();
            return env.reporter().reportFailure(chunk, "timed out");
        }

        if (result.isError()) {
            log.warn("Run failed: worker={}, runId={}, errorType={}, error={}",
                    workerId, runId, result.errorType(), result.errorMessage());
            return env.reporter().reportFailure(chunk, result.errorType() + " " + result.errorMessage());
        }

        if (profile != null) {
            profile.record(result.context());
        }
        Tensor output = result.context().get(model.outputName()).orElseThrow(() ->
                new BatchExecutionException("Run produced no output " + model.outputName()));
        return env.reporter().report(chunk, output);
    }

    /**
     * Waits for a device callback, honouring the configured run timeout.
     */
    private <T> T await(CompletableFuture<T> future) throws TimeoutException {
        long timeoutMs = env.batchConfig().getRunTimeoutMs();
        try {
            return timeoutMs > 0 ? future.get(timeoutMs, TimeUnit.MILLISECONDS) : future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchExecutionException("Interrupted while waiting for the device", e);
        } catch (ExecutionException e) {
            throw new BatchExecutionException("Device callback failed", e.getCause());
        }
    }

    public int getWorkerId() {
        return workerId;
    }
}
