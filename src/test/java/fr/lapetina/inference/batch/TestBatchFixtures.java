package fr.lapetina.inference.batch;

import fr.lapetina.inference.compiler.CompiledModel;
import fr.lapetina.inference.compiler.ModelCompilationException;
import fr.lapetina.inference.compiler.ModelCompiler;
import fr.lapetina.inference.device.CompiledFunction;
import fr.lapetina.inference.device.DeviceManager;
import fr.lapetina.inference.device.InProcessDeviceManager;
import fr.lapetina.inference.domain.model.ElemKind;
import fr.lapetina.inference.domain.model.ExecutionContext;
import fr.lapetina.inference.domain.model.Tensor;
import fr.lapetina.inference.domain.model.TensorType;
import fr.lapetina.inference.executor.SerialExecutor;
import fr.lapetina.inference.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.preprocess.InputPreprocessor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Stand-ins for the preprocessing and compilation collaborators.
 *
 * A job named {@code name:k} becomes a one-hot row with {@code k} set, and the
 * compiled model copies its input to its output, so the reported label of a
 * job is {@code k}.
 */
final class TestBatchFixtures {

    static final int LABELS = 4;

    private TestBatchFixtures() {
    }

    static final class OneHotPreprocessor implements InputPreprocessor {
        @Override
        public Tensor loadAndPreprocess(List<String> files) throws IOException {
            Tensor tensor = new Tensor(TensorType.of(ElemKind.FLOAT, files.size(), LABELS));
            for (int n = 0; n < files.size(); n++) {
                String file = files.get(n);
                int colon = file.lastIndexOf(':');
                if (colon < 0) {
                    throw new IOException("Unreadable input: " + file);
                }
                tensor.set(n * LABELS + Integer.parseInt(file.substring(colon + 1)), 1f);
            }
            return tensor;
        }
    }

    static final class IdentityCompiler implements ModelCompiler {
        final AtomicInteger compilations = new AtomicInteger();
        final Set<String> compilingThreads = ConcurrentHashMap.newKeySet();
        volatile boolean failCompilation;
        /** Runs block until the device interrupts them. */
        volatile boolean hangRuns;
        final AtomicInteger interruptedRuns = new AtomicInteger();

        @Override
        public CompiledModel compile(String networkName, TensorType inputType) throws ModelCompilationException {
            if (failCompilation) {
                throw new ModelCompilationException("cannot compile " + networkName);
            }
            compilations.incrementAndGet();
            compilingThreads.add(Thread.currentThread().getName());
            CompiledFunction identity = new CompiledFunction() {
                @Override
                public Map<String, TensorType> getInputTypes() {
                    return Map.of("data", inputType);
                }

                @Override
                public void execute(ExecutionContext context) {
                    if (hangRuns) {
                        try {
                            new CountDownLatch(1).await();
                        } catch (InterruptedException e) {
                            interruptedRuns.incrementAndGet();
                            Thread.currentThread().interrupt();
                            return;
                        }
                    }
                    context.bind("out", new Tensor(inputType, context.get("data").orElseThrow().toArray()));
                }
            };
            return new CompiledModel(networkName, "data", "out", inputType, inputType, identity);
        }

        @Override
        public void emitBundle(CompiledModel model, Path bundlePath) throws ModelCompilationException {
            try {
                Files.writeString(bundlePath, model.networkName() + " " + model.inputType());
            } catch (IOException e) {
                throw new ModelCompilationException("cannot write " + bundlePath, e);
            }
        }

        @Override
        public String getModelDescription() {
            return "identity";
        }
    }

    /**
     * Creates in-process devices and remembers them.
     */
    static final class RecordingDeviceProvider implements Function<String, DeviceManager> {
        private final MetricsRegistry metricsRegistry;
        final List<DeviceManager> created = new CopyOnWriteArrayList<>();
        final Map<String, SerialExecutor> executors = new ConcurrentHashMap<>();

        RecordingDeviceProvider(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
        }

        @Override
        public DeviceManager apply(String name) {
            SerialExecutor executor = SerialExecutor.builder()
                    .name(name)
                    .metricsRegistry(metricsRegistry)
                    .build();
            executors.put(name, executor);
            DeviceManager device = new InProcessDeviceManager(name, 4, executor, metricsRegistry);
            created.add(device);
            return device;
        }
    }
}
