package com.doccrawler.core.sink;

import com.doccrawler.core.api.IContentSink;
import com.doccrawler.core.api.IDocumentConverter;
import com.doccrawler.core.error.ConversionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * 단일 파일 누적 싱크. 레코드 형식:
 * <pre>
 * \n---\nsource: URL\ncrawled_at: yyyy-MM-dd HH:mm:ss\n---\n\n본문\n\n---\n
 * </pre>
 * 레코드는 통째로 붙거나 전혀 안 붙는다(쓰기 실패 시 이전 길이로 잘라냄).
 * 실행 간에도 이어 붙인다.
 */
public final class AggregateFileSink implements IContentSink {
    private static final Logger log = LoggerFactory.getLogger(AggregateFileSink.class);
    static final DateTimeFormatter CRAWLED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path file;
    private final IDocumentConverter converter;
    private final Clock clock;

    public AggregateFileSink(Path file, IDocumentConverter converter, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.converter = Objects.requireNonNull(converter, "converter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void record(URI url, String text) throws IOException {
        String content = toDocument(url, text);
        String record = "\n---\n"
                + "source: " + url + "\n"
                + "crawled_at: " + CRAWLED_AT.format(LocalDateTime.now(clock)) + "\n"
                + "---\n\n"
                + content + "\n\n---\n";
        append(record.getBytes(StandardCharsets.UTF_8));
    }

    private String toDocument(URI url, String text) {
        try {
            return converter.convert(text);
        } catch (ConversionException e) {
            log.warn("conversion failed for {} ({}); recording plain text", url, e.getMessage());
            return text;
        }
    }

    private void append(byte[] bytes) throws IOException {
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            long start = ch.size();
            ch.position(start);
            try {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) ch.write(buf);
            } catch (IOException e) {
                try {
                    ch.truncate(start);
                } catch (IOException te) {
                    e.addSuppressed(te);
                }
                throw e;
            }
        }
    }

    @Override
    public Path location() {
        return file;
    }
}
