// File: src/main/java/com/example/docxcleaner/CharacterFilter.java
package com.example.docxcleaner;

import java.util.Map;
import java.util.Set;

/** 按码点过滤：只删除黑名单中的字符，其余原样保留（不做归一化/空白合并） */
public final class CharacterFilter {
    private CharacterFilter() {}

    public static String filter(String text, Set<Integer> denylist) {
        return filter(text, denylist, null);
    }

    /**
     * 同 {@link #filter(String, Set)}，并把每个被删除码点的次数累加到 {@code removed}（可为 null）。
     * 代理对按一个码点处理；孤立代理项按其自身值判断。
     */
    public static String filter(String text, Set<Integer> denylist, Map<Integer, Integer> removed) {
        if (text == null || text.isEmpty() || denylist == null || denylist.isEmpty()) return text;

        StringBuilder sb = null;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int len = Character.charCount(cp);
            if (denylist.contains(cp)) {
                if (sb == null) {
                    sb = new StringBuilder(text.length());
                    sb.append(text, 0, i);
                }
                if (removed != null) removed.merge(cp, 1, Integer::sum);
            } else if (sb != null) {
                sb.append(text, i, i + len);
            }
            i += len;
        }
        // 没有命中时返回原实例
        return sb == null ? text : sb.toString();
    }
}
