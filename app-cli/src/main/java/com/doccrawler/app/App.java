package com.doccrawler.app;

import com.doccrawler.app.cli.CliArgs;
import com.doccrawler.app.cli.CliOptions;
import com.doccrawler.app.cli.ExitCode;
import com.doccrawler.app.cli.UsageException;
import com.doccrawler.app.logging.LogSetup;
import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.CrawlReport;
import com.doccrawler.core.service.CrawlService;
import com.doccrawler.core.util.ProgressListener;
import com.doccrawler.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;

/** 명령행 진입점: doc-crawler [options] &lt;url&gt; */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** 종료코드를 돌려준다(테스트에서 System.exit 없이 호출) */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions opts;
        try {
            opts = CliArgs.parse(args);
        } catch (UsageException | IllegalArgumentException e) {
            err.println("doc-crawler: " + e.getMessage());
            err.println("Try 'doc-crawler --help' for more information.");
            return ExitCode.USAGE.code();
        }
        if (opts.help()) {
            out.print(CliArgs.USAGE);
            return ExitCode.OK.code();
        }

        // 기본값 < YAML < CLI
        CrawlConfig cfg = CrawlConfig.defaults();
        try {
            if (opts.configFile() != null) YamlConfigLoader.load(opts.configFile(), cfg);
            opts.applyTo(cfg);
            if (cfg.getTarget() == null) throw new IllegalArgumentException("no URL given");
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("doc-crawler: " + e.getMessage());
            return ExitCode.USAGE.code();
        }

        LogSetup.configure(cfg.getOutputDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in thread {}", t.getName(), e));

        CrawlReport report;
        try {
            ProgressListener progress = (visited, budget, url, recorded) ->
                    out.printf("[%d%s] %s %s%n", visited, budget < 0 ? "" : "/" + budget,
                            recorded ? "saved" : "skipped", url);
            report = new CrawlService(cfg).run(progress);
        } catch (IOException e) {
            LOG.error("Cannot prepare output directory {}: {}", cfg.getOutputDir(), e.toString());
            err.println("doc-crawler: cannot prepare output: " + e.getMessage());
            return ExitCode.SETUP_FAILURE.code();
        } catch (RuntimeException e) {
            LOG.error("Crawl aborted", e);
            err.println("doc-crawler: crawl aborted: " + e);
            return ExitCode.SETUP_FAILURE.code();
        }

        out.printf("Crawl finished: %d visited, %d saved, %d failed in %.1fs -> %s%n",
                report.pagesVisited(), report.pagesRecorded(), report.pagesFailed(),
                report.elapsed().toMillis() / 1000.0, report.output());
        if (report.interrupted()) out.println("(interrupted before the crawl was complete)");

        return report.recordedAnything() ? ExitCode.OK.code() : ExitCode.NOTHING_RECORDED.code();
    }
}
