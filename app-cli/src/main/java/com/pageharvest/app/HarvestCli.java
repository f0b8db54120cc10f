package com.pageharvest.app;

import com.pageharvest.core.api.IProxySource;
import com.pageharvest.core.client.ClientHandle;
import com.pageharvest.core.executor.ScriptPageExtractor;
import com.pageharvest.core.model.FetchConfig;
import com.pageharvest.core.model.ProgressSnapshot;
import com.pageharvest.core.model.ResultRecord;
import com.pageharvest.core.model.WorkItem;
import com.pageharvest.core.proxy.YamlProxySource;
import com.pageharvest.core.service.FetchService;
import com.pageharvest.core.service.WorkerFailureException;
import com.pageharvest.core.util.LoggingConfigurator;
import com.pageharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;

/**
 * harvest &lt;config.yml&gt; &lt;items-file&gt; &lt;out.json&gt; [--mode http|browser]
 * <p>
 * System props: -Dph.out.dir (로그 루트, 기본 "out"), -Dph.log.level, -Dph.log.sizeMb, -Dph.log.files
 */
public final class HarvestCli {
    private static final Logger LOG = LoggerFactory.getLogger(HarvestCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    enum Mode { HTTP, BROWSER }

    record Args(Path config, Path items, Path out, Mode mode) {}

    private HarvestCli() {}

    public static void main(String[] argv) {
        System.exit(run(argv));
    }

    static int run(String[] argv) {
        Args args;
        try {
            args = parseArgs(argv);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(usage());
            return EXIT_USAGE;
        }

        Path logDir = Path.of(System.getProperty("ph.out.dir", "out")).resolve("logs");
        LoggingConfigurator.init(logDir,
                LoggingConfigurator.parseLevel(System.getProperty("ph.log.level"), Level.INFO),
                Integer.getInteger("ph.log.sizeMb", 2) * 1024 * 1024,
                Integer.getInteger("ph.log.files", 5));

        try {
            FetchConfig cfg = YamlConfigLoader.load(args.config());
            List<WorkItem> items = ItemsReader.read(args.items());
            LOG.info("Loaded {} items from {} (mode={})", items.size(), args.items(), args.mode());

            IProxySource proxies = (cfg.getProxyFile() != null) ? new YamlProxySource(cfg.getProxyFile()) : IProxySource.NONE;
            FetchService<? extends ClientHandle> service = (args.mode() == Mode.BROWSER)
                    ? FetchService.browser(cfg, proxies, ScriptPageExtractor.fromFile(cfg.getBrowser().getScriptFile()))
                    : FetchService.http(cfg, proxies);

            List<ResultRecord> results = service.run(items);
            ResultsWriter.write(results, args.out());

            ProgressSnapshot s = service.getLastSnapshot();
            LOG.info("Wrote {} results to {}", results.size(), args.out().toAbsolutePath());
            if (s != null) {
                System.out.printf(Locale.ROOT, "done: %d items, %d successful, %d failed, %d retries, %.1fs%n",
                        s.total, s.succeeded, s.failed, s.retried, s.elapsedMs / 1000.0);
            }
            return EXIT_OK;

        } catch (IOException | UncheckedIOException e) {
            LOG.error("I/O failure: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (WorkerFailureException e) {
            LOG.error("Run aborted: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    static Args parseArgs(String[] argv) {
        Mode mode = Mode.HTTP;
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < argv.length; i++) {
            String a = argv[i];
            if (a.equals("--mode")) {
                if (i + 1 >= argv.length) throw new IllegalArgumentException("--mode requires a value");
                mode = parseMode(argv[++i]);
            } else if (a.startsWith("--mode=")) {
                mode = parseMode(a.substring("--mode=".length()));
            } else if (a.startsWith("--")) {
                throw new IllegalArgumentException("unknown option: " + a);
            } else {
                positional.add(a);
            }
        }
        if (positional.size() != 3) {
            throw new IllegalArgumentException("expected 3 arguments, got " + positional.size());
        }
        return new Args(Path.of(positional.get(0)), Path.of(positional.get(1)), Path.of(positional.get(2)), mode);
    }

    private static Mode parseMode(String s) {
        try {
            return Mode.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown mode: " + s + " (http|browser)");
        }
    }

    static String usage() {
        return "usage: harvest <config.yml> <items-file> <out.json> [--mode http|browser]";
    }
}
