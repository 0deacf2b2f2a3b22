package io.kassa.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.kassa.cli.CliContext;
import io.kassa.cli.DbInitCommand;
import io.kassa.cli.KassaCliCommand;
import io.kassa.cli.ServeCommand;
import io.kassa.cli.StatusCommand;
import io.kassa.core.api.MerchantBackend;
import io.kassa.core.api.MerchantHttpServer;
import io.kassa.core.config.ConfigPaths;
import io.kassa.core.config.ConfigService;
import io.kassa.core.config.model.AuditorConfig;
import io.kassa.core.config.model.ExchangeConfig;
import io.kassa.core.config.model.KassaConfig;
import io.kassa.core.config.model.MerchantSettings;
import io.kassa.core.db.SqliteMerchantDb;
import io.kassa.core.exchange.AuditorPolicy;
import io.kassa.core.instance.InstanceRegistry;
import io.kassa.core.longpoll.LongPollHub;
import io.kassa.core.pay.PayService;
import io.kassa.core.poll.PollPaymentService;
import io.kassa.core.refund.RefundIncreaseService;
import io.kassa.core.refund.RefundLookupService;
import io.kassa.exchange.HttpExchangeClient;
import io.kassa.exchange.TrustedExchange;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.stream.Collectors;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class KassaApplication {
    private static final Logger LOG = LoggerFactory.getLogger(KassaApplication.class);

    private KassaApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        Map<String, String> environment = System.getenv();

        CliContext context = new CliContext(
            configService,
            configPath,
            environment,
            (port, host) -> runServer(configService, configPath, environment, port, host)
        );

        CommandLine commandLine = new CommandLine(new KassaCliCommand());
        commandLine.addSubcommand("serve", new ServeCommand(context));
        commandLine.addSubcommand("dbinit", new DbInitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static int runServer(
        ConfigService configService,
        Path configPath,
        Map<String, String> environment,
        Integer portOverride,
        String hostOverride
    ) throws Exception {
        KassaConfig config = configService.applyEnvironment(configService.load(configPath), environment);
        MerchantSettings settings = config.merchant();
        if (portOverride != null) {
            settings = settings.withPort(portOverride);
        }
        String host = hostOverride != null ? hostOverride : settings.host();
        if (settings.currency() == null || settings.currency().isBlank()) {
            System.err.println("No currency configured under merchant.currency");
            return 1;
        }
        InstanceRegistry instances = configService.buildInstances(config);
        if (instances.all().isEmpty()) {
            System.err.println("No merchant instance configured; run 'kassa dbinit' first");
            return 1;
        }

        Clock clock = Clock.systemUTC();
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .callTimeout(settings.httpTimeout())
            .build();
        List<TrustedExchange> trusted = config.exchanges().stream()
            .map(exchange -> new TrustedExchange(exchange.url(), exchange.masterPublicKey()))
            .collect(Collectors.toList());
        List<String> auditorKeys = config.auditors().stream()
            .map(AuditorConfig::publicKey)
            .collect(Collectors.toList());
        LOG.info("Trusting {} exchange(s) and {} auditor(s)", trusted.size(), auditorKeys.size());

        CountDownLatch shutdown = new CountDownLatch(1);
        try (SqliteMerchantDb db = new SqliteMerchantDb(ConfigPaths.resolve(settings.database()));
             HttpExchangeClient exchanges = new HttpExchangeClient(httpClient, new ObjectMapper(), trusted, clock);
             LongPollHub hub = new LongPollHub(clock);
             PayService pay = new PayService(
                 db,
                 settings.currency(),
                 exchanges,
                 hub,
                 new AuditorPolicy(auditorKeys, settings.forceAudit(), clock),
                 settings.payTimeout(),
                 settings.maxRetries(),
                 clock
             );
             RefundLookupService refundLookup = new RefundLookupService(db, exchanges);
             PollPaymentService pollPayment = new PollPaymentService(db, hub, clock)) {
            MerchantBackend backend = new MerchantBackend(
                instances,
                pay,
                new RefundIncreaseService(db, settings.currency(), settings.maxRetries()),
                refundLookup,
                pollPayment,
                hub
            );
            try (MerchantHttpServer server = new MerchantHttpServer(settings.port(), host, backend)) {
                Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                    server.close();
                    shutdown.countDown();
                }, "kassa-shutdown"));
                server.start();
                System.out.println("Merchant backend started on http://" + host + ":" + server.port());
                System.out.println("Instances: " + instances.all().size() + ", currency " + settings.currency());
                shutdown.await();
            }
        }
        return 0;
    }
}
