package com.telemetra.service.core.query;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only policy for ad-hoc queries, applied to the token stream so string literals, quoted
 * identifiers and comments never trigger a keyword match.
 */
public final class QueryGuard {

    static final Set<String> FORBIDDEN_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "UPSERT", "DROP", "CREATE", "ALTER", "TRUNCATE", "GRANT",
            "REVOKE", "COPY", "VACUUM", "ANALYZE", "CLUSTER", "REINDEX", "COMMENT", "LOCK", "CALL", "DO",
            "EXECUTE", "PREPARE", "DEALLOCATE", "SET", "RESET", "LISTEN", "NOTIFY", "UNLISTEN", "REFRESH",
            "DISCARD", "BEGIN", "COMMIT", "ROLLBACK", "SAVEPOINT", "RELEASE", "INTO", "IMPORT", "LOAD",
            "SECURITY");

    static final Set<String> DENIED_FUNCTIONS = Set.of(
            "pg_sleep", "pg_read_file", "pg_read_binary_file", "pg_ls_dir", "lo_import", "lo_export", "dblink",
            "dblink_exec", "set_config", "pg_terminate_backend", "pg_cancel_backend", "nextval", "setval",
            "pg_advisory_lock", "pg_advisory_xact_lock");

    /** Words after which the tenant column is a plain column reference rather than an alias. */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "SELECT", "DISTINCT", "ALL", "FROM", "JOIN", "ON", "USING", "WHERE", "AND", "OR", "NOT", "BY",
            "HAVING", "CASE", "WHEN", "THEN", "ELSE", "IN", "IS", "LIKE", "ILIKE", "SIMILAR", "BETWEEN",
            "ANY", "SOME", "EXISTS", "LIMIT", "OFFSET", "ESCAPE", "OVER", "PARTITION", "FILTER", "ARRAY",
            "ROW", "LATERAL", "UNION", "INTERSECT", "EXCEPT");

    /** Words that may precede {@code name (} without {@code name} being a relation alias. */
    private static final Set<String> NON_ALIAS_KEYWORDS = Set.of(
            "SELECT", "DISTINCT", "ALL", "FROM", "JOIN", "ON", "USING", "WHERE", "AND", "OR", "NOT", "BY",
            "HAVING", "CASE", "WHEN", "THEN", "ELSE", "IN", "IS", "LIKE", "ILIKE", "SIMILAR", "BETWEEN",
            "ANY", "SOME", "EXISTS", "LIMIT", "OFFSET", "ESCAPE", "OVER", "PARTITION", "FILTER", "ARRAY",
            "ROW", "LATERAL", "UNION", "INTERSECT", "EXCEPT", "CAST", "WITHIN", "GROUP", "ORDER", "INTERVAL");

    private final String tenantColumn;

    public QueryGuard(String tenantColumn) {
        this.tenantColumn = tenantColumn.toLowerCase(Locale.ROOT);
    }

    /**
     * @return index of the terminating {@code ;}, or {@code tokens.size()} when there is none
     * @throws QueryRejectedException on the first violation
     */
    public int check(List<SqlToken> tokens) {
        if (tokens.isEmpty()) {
            throw new QueryRejectedException("Query must not be empty");
        }
        int end = tokens.size();
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).isSymbol(";")) {
                if (i + 1 < tokens.size()) {
                    throw new QueryRejectedException("Only a single statement is allowed");
                }
                end = i;
                break;
            }
        }
        if (end == 0) {
            throw new QueryRejectedException("Query must not be empty");
        }
        if (!tokens.get(0).isWord("SELECT")) {
            throw new QueryRejectedException("Only SELECT statements are allowed");
        }
        int aliasListDepth = 0;
        int parenDepth = 0;
        for (int i = 0; i < end; i++) {
            SqlToken token = tokens.get(i);
            switch (token.type()) {
                case PARAMETER -> throw new QueryRejectedException(
                        "Bind parameters are not supported (found '" + token.text() + "')");
                case WORD -> {
                    String upper = token.text().toUpperCase(Locale.ROOT);
                    if (FORBIDDEN_KEYWORDS.contains(upper)) {
                        throw new QueryRejectedException("Keyword " + upper + " is not allowed in read-only queries");
                    }
                    checkFunction(tokens, i, token.text());
                    checkTenantAlias(tokens, i, aliasListDepth > 0);
                }
                case QUOTED_IDENTIFIER -> {
                    checkFunction(tokens, i, token.text());
                    checkTenantAlias(tokens, i, aliasListDepth > 0);
                }
                case SYMBOL -> {
                    if (token.isSymbol("(")) {
                        parenDepth++;
                        if (aliasListDepth == 0 && opensColumnAliasList(tokens, i)) {
                            aliasListDepth = parenDepth;
                        }
                    } else if (token.isSymbol(")")) {
                        if (parenDepth == 0) {
                            throw unbalanced();
                        }
                        if (parenDepth == aliasListDepth) {
                            aliasListDepth = 0;
                        }
                        parenDepth--;
                    }
                }
                default -> {}
            }
        }
        // the wrapper's derived table must close exactly where the query ends
        if (parenDepth != 0) {
            throw unbalanced();
        }
        return end;
    }

    private static void checkFunction(List<SqlToken> tokens, int i, String name) {
        if (DENIED_FUNCTIONS.contains(name.toLowerCase(Locale.ROOT))
                && i + 1 < tokens.size()
                && tokens.get(i + 1).isSymbol("(")) {
            throw new QueryRejectedException("Function " + name + " is not allowed");
        }
    }

    private void checkTenantAlias(List<SqlToken> tokens, int i, boolean insideAliasList) {
        if (!isTenantColumn(tokens.get(i))) {
            return;
        }
        if (insideAliasList) {
            throw aliasRejected();
        }
        if (i == 0) {
            return;
        }
        SqlToken prev = tokens.get(i - 1);
        boolean alias =
                switch (prev.type()) {
                    case STRING, NUMBER, QUOTED_IDENTIFIER -> true;
                    case SYMBOL -> prev.isSymbol(")");
                    case WORD -> prev.isWord("AS")
                            || !EXPRESSION_KEYWORDS.contains(prev.text().toUpperCase(Locale.ROOT));
                    default -> false;
                };
        if (alias) {
            throw aliasRejected();
        }
    }

    /** {@code AS t (a, b)}, {@code ) t (a, b)} and {@code relation t (a, b)} rename the columns of t. */
    private static boolean opensColumnAliasList(List<SqlToken> tokens, int i) {
        if (i < 2) {
            return false;
        }
        SqlToken name = tokens.get(i - 1);
        SqlToken before = tokens.get(i - 2);
        if (name.type() != SqlToken.Type.WORD && name.type() != SqlToken.Type.QUOTED_IDENTIFIER) {
            return false;
        }
        if (name.type() == SqlToken.Type.WORD) {
            String upper = name.text().toUpperCase(Locale.ROOT);
            if (NON_ALIAS_KEYWORDS.contains(upper) || upper.equals("AS") || upper.equals("VALUES")) {
                return false;
            }
        }
        if (before.isWord("AS") || before.isWord("WITH") || before.isWord("RECURSIVE") || before.isSymbol(")")) {
            return true;
        }
        if (before.type() == SqlToken.Type.QUOTED_IDENTIFIER) {
            return true;
        }
        return before.type() == SqlToken.Type.WORD
                && !NON_ALIAS_KEYWORDS.contains(before.text().toUpperCase(Locale.ROOT));
    }

    private boolean isTenantColumn(SqlToken token) {
        return switch (token.type()) {
            case WORD -> token.text().toLowerCase(Locale.ROOT).equals(tenantColumn);
            case QUOTED_IDENTIFIER -> token.text().equals(tenantColumn);
            default -> false;
        };
    }

    private static QueryRejectedException unbalanced() {
        return new QueryRejectedException("Unbalanced parentheses");
    }

    private QueryRejectedException aliasRejected() {
        return new QueryRejectedException("The " + tenantColumn + " column cannot be aliased or redefined");
    }
}
