package com.doccrawler.app.cli;

/** 잘못된 명령행. 종료코드 2 */
public class UsageException extends Exception {
    public UsageException(String message) { super(message); }
}
