package com.doccrawler.core.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Optional;

/**
 * 페이지 단계 실행기: 시도 → 실패 시 WARN 로그 → 빈 결과로 계속.
 * 한 페이지의 실패가 크롤 전체를 멈추지 않도록 모든 단계가 이걸 거친다.
 */
final class PageStepGuard {
    private static final Logger log = LoggerFactory.getLogger(PageStepGuard.class);

    @FunctionalInterface
    interface Step<T> {
        T run() throws Exception;
    }

    /** 성공이면 결과, 예외나 null 이면 empty */
    <T> Optional<T> attempt(URI url, String step, Step<T> body) {
        try {
            return Optional.ofNullable(body.run());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] {} interrupted", step, url);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("[{}] {} failed: {}", step, url, String.valueOf(e.getMessage()));
            log.debug("[{}] {} failure detail", step, url, e);
            return Optional.empty();
        }
    }
}
