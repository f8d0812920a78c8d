package com.doccrawler.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 호출만 기록하는 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
