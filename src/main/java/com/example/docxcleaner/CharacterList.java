package com.example.docxcleaner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** 待删除字符清单：码点集合（不可变）+ 每个码点的显示名 */
public final class CharacterList {

    public static final String UNKNOWN = "UNKNOWN";

    private final Map<Integer, String> names;

    public CharacterList(Map<Integer, String> names) {
        this.names = Collections.unmodifiableMap(new LinkedHashMap<>(names));
    }

    public static CharacterList empty() {
        return new CharacterList(Collections.emptyMap());
    }

    public Set<Integer> denylist() {
        return names.keySet();
    }

    public String nameOf(int codePoint) {
        return names.getOrDefault(codePoint, UNKNOWN);
    }

    public int size() {
        return names.size();
    }

    public static String formatCodePoint(int codePoint) {
        return String.format("U+%04X", codePoint);
    }
}
