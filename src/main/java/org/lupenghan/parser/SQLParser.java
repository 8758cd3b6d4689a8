package org.lupenghan.parser;

import org.lupenghan.parser.statement.CreateStatement;
import org.lupenghan.parser.statement.CreateType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 把 CREATE TABLE / DATABASE / INDEX 文本解析成 {@link CreateStatement}
 */
public class SQLParser {

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "CREATE\\s+TABLE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)\\s*\\((.*)\\)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern DATABASE_PATTERN = Pattern.compile(
            "CREATE\\s+DATABASE\\s+(IF\\s+NOT\\s+EXISTS\\s+)?(\\w+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern INDEX_PATTERN = Pattern.compile(
            "CREATE\\s+(UNIQUE\\s+)?INDEX\\s+(\\w+)\\s+ON\\s+(\\w+)\\s*(?:\\(([^)]*)\\))?",
            Pattern.CASE_INSENSITIVE);

    public static CreateStatement parse(String sql) {
        // 去除结尾分号并清理空白
        sql = sql.trim().replaceAll(";\\s*$", "").trim();

        Matcher matcher = TABLE_PATTERN.matcher(sql);
        if (matcher.matches()) {
            return CreateStatement.builder()
                    .type(CreateType.TABLE)
                    .ifNotExists(matcher.group(1) != null)
                    .name(matcher.group(2))
                    .columns(TableParser.parseColumns(matcher.group(3)))
                    .build();
        }

        matcher = DATABASE_PATTERN.matcher(sql);
        if (matcher.matches()) {
            return CreateStatement.builder()
                    .type(CreateType.DATABASE)
                    .ifNotExists(matcher.group(1) != null)
                    .name(matcher.group(2))
                    .build();
        }

        matcher = INDEX_PATTERN.matcher(sql);
        if (matcher.matches()) {
            String attrs = matcher.group(4);
            return CreateStatement.builder()
                    .type(CreateType.INDEX)
                    .unique(matcher.group(1) != null)
                    .name(matcher.group(2))
                    .tableName(matcher.group(3))
                    .indexAttrs(attrs == null ? null : TableParser.parseNameList(attrs))
                    .build();
        }

        throw new IllegalArgumentException("无法解析的语句: " + sql);
    }
}
