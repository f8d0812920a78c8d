package com.doccrawler.core.api;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;

/** 추출 결과 기록 계약. 한 크롤 동안 한 가지 전략만 쓴다 */
public interface IContentSink extends AutoCloseable {

    void record(URI url, String text) throws IOException;

    /** 결과가 쌓이는 위치(파일 또는 디렉터리) */
    Path location();

    @Override default void close() throws IOException {}
}
