package com.doccrawler.app.cli;

public enum ExitCode {
    /** 크롤 완료 + 1 페이지 이상 기록 */
    OK(0),
    /** 준비 실패(출력 디렉터리 등) 또는 예기치 못한 오류 */
    SETUP_FAILURE(1),
    /** 명령행/설정 오류 */
    USAGE(2),
    /** 크롤은 끝났지만 기록한 페이지가 없음 */
    NOTHING_RECORDED(3);

    private final int code;

    ExitCode(int code) { this.code = code; }

    public int code() { return code; }
}
