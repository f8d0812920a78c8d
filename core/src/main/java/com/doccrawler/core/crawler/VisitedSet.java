package com.doccrawler.core.crawler;

import com.doccrawler.core.model.PageState;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 방문 집합. 한 번 들어간 URL 은 빠지지 않는다(삽입 순서 유지).
 * tryBegin 은 확인과 삽입을 한 번에 한다.
 */
public final class VisitedSet {

    private final Map<String, PageState> states = new LinkedHashMap<>();

    /** 처음 보는 URL 이면 VISITING 으로 넣고 true */
    public synchronized boolean tryBegin(URI url) {
        return states.putIfAbsent(url.toString(), PageState.VISITING) == null;
    }

    public synchronized void markCompleted(URI url) { transition(url, PageState.COMPLETED); }
    public synchronized void markFailed(URI url)    { transition(url, PageState.FAILED); }

    private void transition(URI url, PageState next) {
        String key = url.toString();
        PageState cur = states.get(key);
        if (cur == null) throw new IllegalStateException("not visited: " + url);
        if (cur.isTerminal()) throw new IllegalStateException(url + " already " + cur);
        states.put(key, next);
    }

    public synchronized boolean contains(URI url) {
        return states.containsKey(url.toString());
    }

    public synchronized PageState state(URI url) {
        return states.get(url.toString());
    }

    public synchronized int size() {
        return states.size();
    }

    public synchronized List<String> urls() {
        return new ArrayList<>(states.keySet());
    }
}
