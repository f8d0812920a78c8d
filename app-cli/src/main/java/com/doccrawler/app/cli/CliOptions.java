package com.doccrawler.app.cli;

import com.doccrawler.core.model.CrawlConfig;
import com.doccrawler.core.model.OutputMode;
import com.doccrawler.core.model.TraversalOrder;

import java.nio.file.Path;

/** 명령행에서 받은 값. null 이면 "지정 안 함" → YAML/기본값 유지 */
public final class CliOptions {
    String url;
    Integer maxPages;
    Path outputDir;
    String userAgent;
    Path configFile;
    OutputMode mode;
    String outputFile;
    boolean breadthFirst;
    boolean help;

    public String url() { return url; }
    public Integer maxPages() { return maxPages; }
    public Path outputDir() { return outputDir; }
    public String userAgent() { return userAgent; }
    public Path configFile() { return configFile; }
    public OutputMode mode() { return mode; }
    public String outputFile() { return outputFile; }
    public boolean breadthFirst() { return breadthFirst; }
    public boolean help() { return help; }

    /** CLI 가 YAML 보다 우선: 지정된 값만 덮어쓴다 */
    public CrawlConfig applyTo(CrawlConfig cfg) {
        if (url != null) cfg.setTarget(url);
        if (maxPages != null) cfg.setMaxPages(maxPages);
        if (outputDir != null) cfg.setOutputDir(outputDir);
        if (userAgent != null) cfg.setUserAgent(userAgent);
        if (mode != null) cfg.setOutputMode(mode);
        if (outputFile != null) cfg.setOutputFileName(outputFile);
        if (breadthFirst) cfg.setTraversalOrder(TraversalOrder.BREADTH_FIRST);
        return cfg;
    }
}
