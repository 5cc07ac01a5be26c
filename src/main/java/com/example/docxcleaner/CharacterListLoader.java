package com.example.docxcleaner;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.parser.Feature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 读取字符清单 JSON：
 * <pre>{ "U+200B": ["ZERO WIDTH SPACE", ""], "0x00AD": "SOFT HYPHEN" }</pre>
 * key 可以是字符本身、U+XXXX、\\uXXXX（字面）、0xXXXX；value 为描述字符串或 [描述, 替换字符]，替换字符不使用。
 */
@Slf4j
public final class CharacterListLoader {
    private CharacterListLoader() {}

    public static final String DEFAULT_RESOURCE = "docx-cleaner-chars.json";

    private static final Pattern HEX_KEY = Pattern.compile("(?:U\\+|\\\\U|0X)([0-9A-F]{1,6})");

    public static CharacterList load(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        CharacterList list = parse(json);
        log.info("loaded {} characters from {}", list.size(), file);
        return list;
    }

    public static CharacterList loadDefault() throws IOException {
        try (InputStream in = CharacterListLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IOException("resource not found: " + DEFAULT_RESOURCE);
            CharacterList list = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("loaded {} characters from classpath:{}", list.size(), DEFAULT_RESOURCE);
            return list;
        }
    }

    public static CharacterList parse(String json) {
        JSONObject obj;
        try {
            obj = JSON.parseObject(json, Feature.OrderedField);
        } catch (JSONException e) {
            throw new IllegalArgumentException("invalid character list JSON: " + e.getMessage(), e);
        }
        if (obj == null) throw new IllegalArgumentException("character list is empty");

        Map<Integer, String> names = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : obj.entrySet()) {
            int cp = parseKey(e.getKey());
            String name = describe(e.getKey(), e.getValue());
            if (names.put(cp, name) != null) {
                log.warn("duplicate character {} in list, keeping last ({})", CharacterList.formatCodePoint(cp), name);
            }
        }
        return new CharacterList(names);
    }

    static int parseKey(String key) {
        if (key == null || key.isEmpty()) throw new IllegalArgumentException("empty character key");
        if (key.codePointCount(0, key.length()) == 1) return key.codePointAt(0);

        Matcher m = HEX_KEY.matcher(key.trim().toUpperCase(Locale.ROOT));
        if (m.matches()) {
            int cp = Integer.parseInt(m.group(1), 16);
            if (Character.isValidCodePoint(cp)) return cp;
        }
        throw new IllegalArgumentException("unrecognized character key: \"" + key + "\"");
    }

    private static String describe(String key, Object value) {
        if (value == null) return CharacterList.UNKNOWN;
        if (value instanceof String) return nonBlankOr((String) value);
        if (value instanceof JSONArray) {
            JSONArray arr = (JSONArray) value;
            return arr.isEmpty() ? CharacterList.UNKNOWN : nonBlankOr(arr.getString(0));
        }
        throw new IllegalArgumentException("value of \"" + key + "\" must be a string or an array");
    }

    private static String nonBlankOr(String s) {
        return (s == null || s.trim().isEmpty()) ? CharacterList.UNKNOWN : s;
    }
}
