package com.doccrawler.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/** URL 정규화 + 동일 호스트 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        // 인코딩된 원문 그대로 다시 조립(%2F, %26 같은 이스케이프 보존)
        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            // 파싱 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /** host + 실효 포트가 같은지(대소문자 무시). 스킴은 보지 않는다 */
    public static boolean sameAuthority(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = a.getHost() == null ? "" : a.getHost().toLowerCase(Locale.ROOT);
        String hb = b.getHost() == null ? "" : b.getHost().toLowerCase(Locale.ROOT);
        return !ha.isEmpty() && ha.equals(hb) && effectivePort(a) == effectivePort(b);
    }

    public static int effectivePort(URI u) {
        if (u.getPort() >= 0) return u.getPort();
        String s = u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("https") ? 443 : 80;
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /** 문자열을 URI로. 잘못된 값이면 null */
    public static URI parse(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return new URI(raw.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /** 경로의 디렉터리 부분: "/a/b/c.html" → "/a/b/", "/a/b/" → "/a/b/" */
    public static String directoryOf(String path) {
        if (path == null || path.isEmpty()) return "/";
        int i = path.lastIndexOf('/');
        return i < 0 ? "/" : path.substring(0, i + 1);
    }
}
