package com.doccrawler.app.cli;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.OutputMode;

import java.nio.file.Path;

public final class CliArgs {
    private CliArgs() {}

    public static final String USAGE = """
            Usage: doc-crawler [options] <url>

            Crawls a documentation site and saves the text of every page.

            Options:
              --max-pages N          Stop after N pages (default: unlimited)
              --output-dir PATH      Output directory (default: output)
              --user-agent STR       User-Agent string (default: %s)
              --config FILE          Read settings from a YAML file (flags override it)
              --mode MODE            aggregate | per-page (default: aggregate)
              --output-file NAME     Aggregate file name (default: %s)
              --breadth-first        Visit pages level by level instead of depth-first
              -h, --help             Show this help

            Examples:
              doc-crawler https://docs.python.org/3/ --max-pages 50
              doc-crawler --config crawl.yml --mode per-page
            """.formatted(CrawlConfig.DEFAULT_USER_AGENT, CrawlConfig.DEFAULT_OUTPUT_FILE);

    public static CliOptions parse(String[] args) throws UsageException {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-h", "--help" -> o.help = true;
                case "--max-pages", "--maxPages" -> {
                    String v = value(args, ++i, a);
                    try {
                        o.maxPages = Integer.parseInt(v);
                    } catch (NumberFormatException e) {
                        throw new UsageException("invalid number for " + a + ": " + v);
                    }
                    if (o.maxPages < 1) throw new UsageException(a + " must be at least 1");
                }
                case "--output-dir" -> o.outputDir = Path.of(value(args, ++i, a));
                case "--user-agent", "-A" -> o.userAgent = value(args, ++i, a);
                case "--config" -> o.configFile = Path.of(value(args, ++i, a));
                case "--mode" -> {
                    String v = value(args, ++i, a);
                    try {
                        o.mode = OutputMode.parse(v);
                    } catch (IllegalArgumentException e) {
                        throw new UsageException(e.getMessage());
                    }
                }
                case "--output-file" -> o.outputFile = value(args, ++i, a);
                case "--breadth-first" -> o.breadthFirst = true;
                default -> {
                    if (a.startsWith("-")) throw new UsageException("unknown option " + a);
                    if (o.url != null) throw new UsageException("only one URL may be given (got " + o.url + " and " + a + ")");
                    o.url = a;
                }
            }
        }
        return o;
    }

    private static String value(String[] args, int i, String option) throws UsageException {
        if (i >= args.length) throw new UsageException("missing value for option " + option);
        return args[i];
    }
}
