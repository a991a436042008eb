package com.gdin.radiology.report.generation;

import com.gdin.radiology.report.exception.PlaceholderResolutionException;

import java.util.Map;

/**
 * 模板骨架占位符替换：{name} 替换为取值，{{ 与 }} 转义为字面量花括号。
 * 占位符未知或取值为 null 时抛出 PlaceholderResolutionException。
 */
public final class SkeletonFormatter {

    private SkeletonFormatter() {
    }

    public static String format(String skeleton, Map<String, String> values) {
        if (skeleton == null) return "";
        StringBuilder out = new StringBuilder(skeleton.length() + 128);
        int i = 0;
        int n = skeleton.length();
        while (i < n) {
            char c = skeleton.charAt(i);
            if (c == '{') {
                if (i + 1 < n && skeleton.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = skeleton.indexOf('}', i + 1);
                if (close < 0) throw new PlaceholderResolutionException(skeleton.substring(i + 1), "unclosed '{'");
                String name = skeleton.substring(i + 1, close);
                if (!values.containsKey(name)) throw new PlaceholderResolutionException(name, "unknown placeholder");
                String value = values.get(name);
                if (value == null) throw new PlaceholderResolutionException(name, "no value provided");
                out.append(value);
                i = close + 1;
            } else if (c == '}') {
                if (i + 1 < n && skeleton.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new PlaceholderResolutionException("}", "single '}' must be written as '}}'");
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
