package io.fixorder.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fixorder.model.FixCanonicalizer;
import io.fixorder.model.FixField;
import io.fixorder.model.FixIntegrityCheck;
import io.fixorder.model.FixMessage;
import io.fixorder.order.FixSession;
import io.fixorder.order.NewOrderSingle;
import io.fixorder.order.NewOrderSingleBuilder;
import io.fixorder.order.OrderRequest;
import io.fixorder.order.OrderValidationException;
import io.fixorder.order.SequenceCounter;
import io.fixorder.transport.AsyncOrderEntryClient;
import io.fixorder.transport.OrderEntryClient;
import io.fixorder.transport.SubmissionResult;
import io.fixorder.transport.TcpOrderTransport;
import io.fixorder.transport.TransportOutcome;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "fix-order",
    mixinStandardHelpOptions = true,
    versionProvider = FixOrderCli.VersionProvider.class,
    description = "Build and send FIX 4.2 NewOrderSingle messages",
    subcommands = {
        FixOrderCli.SendCommand.class,
        FixOrderCli.BuildCommand.class,
        FixOrderCli.InspectCommand.class
    }
)
public final class FixOrderCli implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_SEND_FAIL = 2;
    static final int EXIT_CONFIG_ERROR = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(FixOrderCli.class);
    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getOut().println("fix-order version " + currentVersion());
        return EXIT_OK;
    }

    static String currentVersion() {
        String version = System.getProperty("fix.order.version");
        return version == null || version.isBlank() ? "0.1.0-SNAPSHOT" : version;
    }

    static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new FixOrderCli());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_CONFIG_ERROR;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println(ex.getMessage());
            return EXIT_CONFIG_ERROR;
        });
        return commandLine;
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }

    public static final class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"fix-order " + currentVersion()};
        }
    }

    static final class SessionOptions {
        @Option(names = "--config", description = "Client config file (.yaml, .yml or .json)")
        Path configFile;

        @Option(names = "--host", description = "Counterparty host (default: 127.0.0.1)")
        String host;

        @Option(names = "--port", description = "Counterparty port (default: 9876)")
        Integer port;

        @Option(names = "--sender", description = "SenderCompID (default: CLIENT1)")
        String senderCompId;

        @Option(names = "--target", description = "TargetCompID (default: SERVER1)")
        String targetCompId;

        @Option(names = "--connect-timeout-ms", description = "Connect timeout in milliseconds (default: 8000)")
        Long connectTimeoutMs;

        @Option(names = "--read-timeout-ms", description = "Response wait in milliseconds (default: 8000)")
        Long readTimeoutMs;

        ClientConfig resolve() throws IOException {
            ClientConfig base = configFile == null ? ClientConfig.defaults() : ClientConfig.load(configFile);
            ClientConfig.Builder builder = base.toBuilder();
            if (host != null) {
                builder.host(host);
            }
            if (port != null) {
                builder.port(port);
            }
            if (senderCompId != null) {
                builder.senderCompId(senderCompId);
            }
            if (targetCompId != null) {
                builder.targetCompId(targetCompId);
            }
            if (connectTimeoutMs != null) {
                builder.connectTimeoutMs(connectTimeoutMs);
            }
            if (readTimeoutMs != null) {
                builder.readTimeoutMs(readTimeoutMs);
            }
            ClientConfig resolved = builder.build();
            LOGGER.debug("Resolved client config {}", resolved.toSummary());
            return resolved;
        }
    }

    static final class OrderOptions {
        @Option(names = "--symbol", required = true, description = "Instrument symbol, upper-cased before sending")
        String symbol;

        @Option(names = "--side", defaultValue = "BUY", description = "BUY or SELL (default: ${DEFAULT-VALUE})")
        String side;

        @Option(names = "--qty", required = true, description = "Order quantity; fractions are truncated")
        String quantity;

        @Option(names = "--price", required = true, description = "Limit price")
        String price;

        OrderRequest parse() {
            return OrderRequest.parse(symbol, side, quantity, price);
        }

        OrderRequest toRequest() {
            return parse().validate();
        }
    }

    @Command(
        name = "send",
        mixinStandardHelpOptions = true,
        description = "Send NewOrderSingle message(s) and print what was exchanged"
    )
    static final class SendCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Mixin
        private SessionOptions sessionOptions = new SessionOptions();

        @Mixin
        private OrderOptions orderOptions = new OrderOptions();

        @Option(names = "--count", defaultValue = "1", description = "Number of orders to send on one session")
        private int count;

        @Option(names = "--json", description = "Write a JSON report to this file")
        private Path jsonOut;

        @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
        private boolean verbose;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            if (verbose) {
                LoggingConfigurator.enableVerboseLogging();
            }

            ClientConfig config;
            try {
                if (count <= 0) {
                    throw new IllegalArgumentException("--count must be > 0");
                }
                config = sessionOptions.resolve();
            } catch (IOException | IllegalArgumentException configFailure) {
                err.println(configFailure.getMessage());
                err.flush();
                return EXIT_CONFIG_ERROR;
            }

            ConsoleOrderEntryListener listener = new ConsoleOrderEntryListener(out, err);
            OrderRequest order;
            try {
                order = orderOptions.parse();
            } catch (OrderValidationException invalid) {
                listener.onRejected(null, invalid);
                return EXIT_CONFIG_ERROR;
            }

            OrderEntryClient client = new OrderEntryClient(
                config.newSession(),
                new NewOrderSingleBuilder(),
                new TcpOrderTransport(),
                config.endpoint(),
                config.timeouts(),
                listener
            );

            List<SubmissionResult> results = new ArrayList<>(count);
            try (AsyncOrderEntryClient async = new AsyncOrderEntryClient(client)) {
                for (int i = 0; i < count; i++) {
                    results.add(async.submit(order).join());
                }
            } catch (CompletionException submitFailure) {
                Throwable cause = submitFailure.getCause() == null ? submitFailure : submitFailure.getCause();
                if (cause instanceof OrderValidationException) {
                    return EXIT_CONFIG_ERROR;
                }
                err.println(cause.getMessage());
                err.flush();
                return EXIT_SEND_FAIL;
            }

            boolean allDelivered = results.stream().allMatch(SubmissionResult::delivered);
            if (jsonOut != null) {
                try {
                    writeJson(jsonOut, buildSendReport(config, results, allDelivered));
                } catch (IOException writeFailure) {
                    err.println(writeFailure.getMessage());
                    return EXIT_CONFIG_ERROR;
                }
            }
            return allDelivered ? EXIT_OK : EXIT_SEND_FAIL;
        }
    }

    @Command(
        name = "build",
        mixinStandardHelpOptions = true,
        description = "Build a NewOrderSingle and print it without sending"
    )
    static final class BuildCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Mixin
        private SessionOptions sessionOptions = new SessionOptions();

        @Mixin
        private OrderOptions orderOptions = new OrderOptions();

        @Option(names = "--seq-num", defaultValue = "1", description = "MsgSeqNum to use (default: ${DEFAULT-VALUE})")
        private int seqNum;

        @Option(names = "--raw", defaultValue = "false", description = "Print SOH-delimited bytes instead of '|'")
        private boolean raw;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            try {
                ClientConfig config = sessionOptions.resolve();
                FixSession session = new FixSession(
                    config.senderCompId(),
                    config.targetCompId(),
                    new SequenceCounter(seqNum)
                );
                NewOrderSingle message = new NewOrderSingleBuilder().build(session, orderOptions.toRequest());
                out.println(raw ? FixCanonicalizer.toDisplayString(message.payload(), String.valueOf(FixCanonicalizer.SOH))
                    : message.toDisplayString());
                out.flush();
                return EXIT_OK;
            } catch (IOException | IllegalArgumentException buildFailure) {
                spec.commandLine().getErr().println(buildFailure.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }
    }

    @Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "Parse a FIX message ('|', '^A' or SOH delimited) and check BodyLength and CheckSum"
    )
    static final class InspectCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Message text")
        private String message;

        @Option(names = "--file", description = "Read the message from this file instead")
        private Path file;

        @Override
        public Integer call() {
            try {
                String text = readMessage();
                byte[] wire = FixCanonicalizer.normalize(text.strip());
                FixMessage parsed = FixMessage.fromRaw(wire);
                FixIntegrityCheck check = FixIntegrityCheck.of(wire);

                printJson(spec.commandLine().getOut(), buildInspectReport(parsed, check));
                return check.valid() ? EXIT_OK : EXIT_SEND_FAIL;
            } catch (IOException | IllegalArgumentException inspectFailure) {
                spec.commandLine().getErr().println(inspectFailure.getMessage());
                return EXIT_CONFIG_ERROR;
            }
        }

        private String readMessage() throws IOException {
            if (file != null) {
                if (!Files.isRegularFile(file)) {
                    throw new IllegalArgumentException("Message file does not exist: " + file);
                }
                return Files.readString(file, StandardCharsets.ISO_8859_1);
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("Provide a message or --file");
            }
            return message;
        }
    }

    private static Map<String, Object> buildSendReport(ClientConfig config, List<SubmissionResult> results, boolean allDelivered) {
        List<Map<String, Object>> orders = new ArrayList<>(results.size());
        for (SubmissionResult result : results) {
            NewOrderSingle message = result.message();
            TransportOutcome outcome = result.outcome();

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("msgSeqNum", message.msgSeqNum());
            entry.put("clOrdId", message.clOrdId());
            entry.put("sendingTime", message.sendingTime());
            entry.put("sent", message.toDisplayString());
            entry.put("outcome", outcome.getClass().getSimpleName());
            entry.put("delivered", outcome.delivered());
            entry.put("detail", outcome.describe());
            if (outcome instanceof TransportOutcome.Received received) {
                byte[] response = received.response();
                entry.put("response", FixCanonicalizer.toDisplayString(response));
                entry.put("responseIntegrityValid", FixIntegrityCheck.of(response).valid());
            }
            orders.add(entry);
        }

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("endpoint", config.endpoint().toString());
        report.put("session", config.senderCompId() + "_" + config.targetCompId());
        report.put("allDelivered", allDelivered);
        report.put("orders", orders);
        return report;
    }

    private static Map<String, Object> buildInspectReport(FixMessage parsed, FixIntegrityCheck check) {
        List<Map<String, Object>> fields = new ArrayList<>(parsed.size());
        for (FixField field : parsed.fields()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("tag", field.tag());
            item.put("value", field.value());
            fields.add(item);
        }

        Map<String, Object> bodyLength = new LinkedHashMap<>();
        bodyLength.put("declared", check.declaredBodyLength());
        bodyLength.put("actual", check.actualBodyLength());
        bodyLength.put("valid", check.bodyLengthValid());

        Map<String, Object> checksum = new LinkedHashMap<>();
        checksum.put("declared", check.declaredChecksum());
        checksum.put("actual", check.actualChecksum());
        checksum.put("valid", check.checksumValid());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("msgType", parsed.msgType());
        report.put("fieldCount", parsed.size());
        report.put("fields", fields);
        report.put("bodyLength", bodyLength);
        report.put("checksum", checksum);
        report.put("valid", check.valid());
        return report;
    }

    private static void printJson(PrintWriter out, Object value) throws IOException {
        out.println(JSON.writeValueAsString(value));
        out.flush();
    }

    private static void writeJson(Path out, Object value) throws IOException {
        Path parent = out.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        JSON.writeValue(out.toFile(), value);
    }
}
