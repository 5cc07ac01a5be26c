// File: src/main/java/com/example/docxcleaner/PartSelector.java
package com.example.docxcleaner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/** 按包内路径判定部件角色：只有正文/页眉/页脚/脚注/尾注/批注需要改写，其余原样复制 */
public final class PartSelector {
    private PartSelector() {}

    public enum PartRole {
        MAIN_DOCUMENT("document"),
        GLOSSARY_DOCUMENT("glossaryDocument"),
        HEADER("hdr"),
        FOOTER("ftr"),
        FOOTNOTES("footnotes"),
        ENDNOTES("endnotes"),
        COMMENTS("comments"),
        PASS_THROUGH(null);

        /** 该部件 w: 命名空间下的根元素本地名 */
        public final String rootLocalName;

        PartRole(String rootLocalName) { this.rootLocalName = rootLocalName; }

        public boolean isTextBearing() { return this != PASS_THROUGH; }
    }

    private static final Map<Pattern, PartRole> TABLE;
    static {
        Map<Pattern, PartRole> t = new LinkedHashMap<>();
        t.put(Pattern.compile("word/document\\d*\\.xml"),   PartRole.MAIN_DOCUMENT);
        t.put(Pattern.compile("word/glossary/document\\.xml"), PartRole.GLOSSARY_DOCUMENT);
        t.put(Pattern.compile("word/header\\d*\\.xml"),     PartRole.HEADER);
        t.put(Pattern.compile("word/footer\\d*\\.xml"),     PartRole.FOOTER);
        t.put(Pattern.compile("word/footnotes\\.xml"),      PartRole.FOOTNOTES);
        t.put(Pattern.compile("word/endnotes\\.xml"),       PartRole.ENDNOTES);
        t.put(Pattern.compile("word/comments\\.xml"),       PartRole.COMMENTS);
        TABLE = Collections.unmodifiableMap(t);
    }

    public static PartRole classify(String entryName) {
        if (entryName == null || entryName.isEmpty()) return PartRole.PASS_THROUGH;
        String name = entryName.startsWith("/") ? entryName.substring(1) : entryName;
        for (Map.Entry<Pattern, PartRole> e : TABLE.entrySet()) {
            if (e.getKey().matcher(name).matches()) return e.getValue();
        }
        return PartRole.PASS_THROUGH;
    }

    public static boolean isTextBearing(String entryName) {
        return classify(entryName).isTextBearing();
    }
}
