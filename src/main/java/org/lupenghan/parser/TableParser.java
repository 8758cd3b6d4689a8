package org.lupenghan.parser;

import org.lupenghan.parser.statement.ColumnDefinition;
import org.lupenghan.parser.statement.DataType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 负责解析 CREATE TABLE 括号内的列定义
 */
public class TableParser {

    private static final Pattern COLUMN_PATTERN = Pattern.compile(
            "(\\w+)\\s+(\\w+)\\s*(?:\\(\\s*(\\d+)\\s*\\))?(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern PRIMARY_PREFIX = Pattern.compile("PRIMARY\\s+KEY\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern FOREIGN_PREFIX = Pattern.compile("FOREIGN\\s+KEY\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PRIMARY_PATTERN = Pattern.compile(
            "PRIMARY\\s+KEY\\s*\\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);

    private static final Pattern FOREIGN_PATTERN = Pattern.compile(
            "FOREIGN\\s+KEY\\s*\\(([^)]*)\\)\\s*REFERENCES\\s+(\\w+)\\s*\\(([^)]*)\\)", Pattern.CASE_INSENSITIVE);

    public static List<ColumnDefinition> parseColumns(String body) {
        List<ColumnDefinition> definitions = new ArrayList<>();
        for (String part : splitTopLevel(body)) {
            part = part.trim();
            if (part.isEmpty()) {
                throw new IllegalArgumentException("空的列定义");
            }
            // 处理 PRIMARY KEY
            if (PRIMARY_PREFIX.matcher(part).lookingAt()) {
                Matcher matcher = PRIMARY_PATTERN.matcher(part);
                if (!matcher.matches()) {
                    throw new IllegalArgumentException("无效的 PRIMARY KEY 语句: " + part);
                }
                definitions.add(ColumnDefinition.builder()
                        .kind(ColumnDefinition.Kind.PRIMARY)
                        .unique(true)
                        .primaryKey(parseNameList(matcher.group(1)))
                        .build());
                continue;
            }

            // 处理 FOREIGN KEY
            if (FOREIGN_PREFIX.matcher(part).lookingAt()) {
                definitions.add(parseForeignKey(part));
                continue;
            }

            // 处理普通列
            parseColumn(part, definitions);
        }
        return definitions;
    }

    /**
     * 解析括号中以逗号分隔的名字列表，允许为空
     */
    public static List<String> parseNameList(String list) {
        List<String> names = new ArrayList<>();
        for (String name : list.split(",")) {
            name = name.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    // 普通列，内联的 PRIMARY KEY 展开成一条单列主键声明
    private static void parseColumn(String part, List<ColumnDefinition> definitions) {
        Matcher matcher = COLUMN_PATTERN.matcher(part);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("无效的列定义: " + part);
        }
        String name = matcher.group(1);
        DataType type = DataType.fromName(matcher.group(2));
        int varlen = 0;
        if (type == DataType.VARCHAR || type == DataType.VARBINARY) {
            if (matcher.group(3) == null) {
                throw new IllegalArgumentException("未找到 " + type + " 长度定义: " + part);
            }
            varlen = Integer.parseInt(matcher.group(3));
        }

        String[] options = matcher.group(4).trim().toUpperCase().split("\\s+");
        boolean notNull = false;
        boolean primary = false;
        for (int i = 0; i < options.length; i++) {
            String token = options[i];
            if (token.isEmpty()) {
                continue;
            }
            if (token.equals("NOT") && i + 1 < options.length && options[i + 1].equals("NULL")) {
                notNull = true;
                i++;
            } else if (token.equals("NULL")) {
                notNull = false;
            } else if (token.equals("PRIMARY") && i + 1 < options.length && options[i + 1].equals("KEY")) {
                primary = true;
                i++;
            } else {
                throw new IllegalArgumentException("无法识别的列选项 '" + token + "': " + part);
            }
        }

        definitions.add(ColumnDefinition.builder()
                .name(name)
                .type(type)
                .notNull(notNull)
                .varlen(varlen)
                .build());
        if (primary) {
            definitions.add(ColumnDefinition.primaryKey(true, name));
        }
    }

    private static ColumnDefinition parseForeignKey(String part) {
        // 示例：FOREIGN KEY (cust_id) REFERENCES customers (id)
        Matcher matcher = FOREIGN_PATTERN.matcher(part);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("无效的 FOREIGN KEY 语句: " + part);
        }
        return ColumnDefinition.foreignKey(
                parseNameList(matcher.group(1)),
                matcher.group(2),
                parseNameList(matcher.group(3)));
    }

    // 只在括号深度为 0 的逗号处切分
    private static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new IllegalArgumentException("括号不匹配: " + body);
                }
            } else if (c == ',' && depth == 0) {
                parts.add(body.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new IllegalArgumentException("括号不匹配: " + body);
        }
        parts.add(body.substring(start));
        return parts;
    }
}
