package com.retailops.tools.support;

import java.util.Map;

/** 工具实现里读取参数的小工具 */
public final class ToolArgs {
    private ToolArgs() {}

    public static String str(Map<String, Object> args, String key) {
        Object o = args.get(key);
        return o == null ? null : String.valueOf(o).trim();
    }

    public static int intOr(Map<String, Object> args, String key, int d) {
        Object o = args.get(key);
        if (o instanceof Number n) return n.intValue();
        try { return o == null ? d : Integer.parseInt(String.valueOf(o).trim()); } catch (NumberFormatException e) { return d; }
    }

    public static double doubleOr(Map<String, Object> args, String key, double d) {
        Object o = args.get(key);
        if (o instanceof Number n) return n.doubleValue();
        try { return o == null ? d : Double.parseDouble(String.valueOf(o).trim()); } catch (NumberFormatException e) { return d; }
    }

    public static String truncate(String s, int n) {
        if (s == null) return null;
        return s.length() <= n ? s : s.substring(0, n) + "...";
    }
}
