package com.doccrawler.core.crawler.robots;

/** robots 로드 시각 기록용 시계. 테스트에서 고정 시계로 교체한다 */
@FunctionalInterface
public interface RobotsClock {
    long nowMillis();

    RobotsClock SYSTEM = System::currentTimeMillis;
}
