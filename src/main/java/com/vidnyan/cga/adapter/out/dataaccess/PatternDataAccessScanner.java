package com.vidnyan.cga.adapter.out.dataaccess;

import com.vidnyan.cga.application.port.out.DataAccessScanner;
import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.DataOperation;
import com.vidnyan.cga.domain.model.Language;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented detection of table accesses: SQL in string literals, Spring Data and TypeORM
 * repositories, JPA entity managers, Django and SQLAlchemy models, Prisma, Supabase and Knex.
 * <p>
 * Table names are normalized to plural snake case ({@code UserRepository} and {@code User}
 * both become {@code users}).
 */
@Slf4j
@Component
public class PatternDataAccessScanner implements DataAccessScanner {

    private static final Pattern SQL_SELECT = Pattern.compile(
            "(?i)[\"'`].*?\\bSELECT\\s+(.*?)\\s+FROM\\s+[\"'`\\[]?([A-Za-z_][\\w.]*)");
    private static final Pattern SQL_INSERT = Pattern.compile(
            "(?i)\\bINSERT\\s+INTO\\s+[\"'`\\[]?([A-Za-z_][\\w.]*)[\"'`\\]]?\\s*(?:\\(([^)]*)\\))?");
    private static final Pattern SQL_UPDATE = Pattern.compile(
            "(?i)\\bUPDATE\\s+[\"'`\\[]?([A-Za-z_][\\w.]*)[\"'`\\]]?\\s+SET\\s+(.*)");
    private static final Pattern SQL_DELETE = Pattern.compile(
            "(?i)\\bDELETE\\s+FROM\\s+[\"'`\\[]?([A-Za-z_][\\w.]*)");
    private static final Pattern ASSIGNED_COLUMN = Pattern.compile("([A-Za-z_]\\w*)\\s*=");

    private static final Pattern REPOSITORY_CALL = Pattern.compile(
            "\\b([A-Za-z_]\\w*(?:Repository|repository|Repo|repo|Dao|DAO|dao))\\s*\\.\\s*(\\w+)\\s*\\(");
    private static final Pattern ENTITY_MANAGER_CALL = Pattern.compile(
            "\\b(entityManager|em|manager)\\s*\\.\\s*(find|getReference|persist|merge|remove)\\s*\\(\\s*(\\w+)?(\\.class)?");
    private static final Pattern DJANGO_CALL = Pattern.compile("\\b([A-Z]\\w*)\\.objects\\.(\\w+)\\s*\\(([^)]*)");
    private static final Pattern KEYWORD_ARGUMENT = Pattern.compile("\\b([a-z_]\\w*?)(?:__\\w+)?\\s*=(?!=)");
    private static final Pattern SQLALCHEMY_QUERY = Pattern.compile(
            "\\b(?:session|sess|db\\.session)\\s*\\.\\s*query\\s*\\(\\s*([A-Z]\\w*)");
    private static final Pattern PRISMA_CALL = Pattern.compile("\\bprisma\\s*\\.\\s*(\\w+)\\s*\\.\\s*(\\w+)\\s*\\(");
    private static final Pattern WHERE_KEYS = Pattern.compile("where\\s*:\\s*\\{([^}]*)\\}");
    private static final Pattern SUPABASE_CALL = Pattern.compile(
            "\\.(?:from|table)\\s*\\(\\s*['\"](\\w+)['\"]\\s*\\)\\s*\\.\\s*(select|insert|update|upsert|delete)\\s*\\(\\s*(?:['\"]([^'\"]*)['\"])?");
    private static final Pattern KNEX_CALL = Pattern.compile(
            "\\b(?:knex|db)\\s*\\(\\s*['\"](\\w+)['\"]\\s*\\)(?:\\s*\\.\\s*(\\w+))?");

    private static final Set<String> REPOSITORY_READS = Set.of("findAll", "findById", "findOne", "getOne", "getById",
            "getReferenceById", "existsById", "count", "findAllById", "find", "findOneBy", "findBy", "findAndCount",
            "findOneOrFail");
    private static final Set<String> REPOSITORY_WRITES = Set.of("save", "saveAll", "saveAndFlush",
            "saveAllAndFlush", "insert", "update", "upsert", "create");
    private static final Set<String> REPOSITORY_DELETES = Set.of("delete", "deleteById", "deleteAll",
            "deleteAllById", "deleteInBatch", "deleteAllInBatch", "deleteAllByIdInBatch", "remove", "softDelete");
    private static final List<String> DERIVED_QUERY_PREFIXES = List.of("findAllBy", "findBy", "getBy", "queryBy",
            "readBy", "countBy", "existsBy", "deleteBy", "removeBy");
    private static final Pattern DERIVED_SUFFIX = Pattern.compile(
            "(?:IsNotNull|IsNull|NotIn|In|Is|Equals|Not|Like|StartingWith|EndingWith|Containing|Between|LessThanEqual"
                    + "|LessThan|GreaterThanEqual|GreaterThan|After|Before|True|False|IgnoreCase)$");

    private static final Set<String> DJANGO_READS = Set.of("get", "filter", "all", "exclude", "count", "exists",
            "first", "last", "values", "values_list", "aggregate", "annotate", "order_by");
    private static final Set<String> DJANGO_WRITES = Set.of("create", "update", "bulk_create", "bulk_update",
            "get_or_create", "update_or_create");
    private static final Set<String> PRISMA_READS = Set.of("findMany", "findUnique", "findFirst", "count",
            "aggregate", "groupBy", "findUniqueOrThrow", "findFirstOrThrow");
    private static final Set<String> PRISMA_WRITES = Set.of("create", "createMany", "update", "updateMany", "upsert");
    private static final Set<String> PRISMA_DELETES = Set.of("delete", "deleteMany");

    @Override
    public List<DataAccessFact> scan(String source, String file, Language language) {
        Map<String, DataAccessFact> facts = new LinkedHashMap<>();
        String[] lines = source.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (commentLine(line, language)) {
                continue;
            }
            List<DataAccessFact> found = new ArrayList<>();
            int number = i + 1;
            sql(line, file, number, found);
            switch (language) {
                case JAVA -> {
                    repository(line, file, number, found);
                    entityManager(line, file, number, found);
                }
                case PYTHON -> {
                    django(line, file, number, found);
                    sqlAlchemy(line, file, number, found);
                    supabase(line, file, number, found);
                    repository(line, file, number, found);
                }
                case TYPESCRIPT, JAVASCRIPT -> {
                    prisma(line, file, number, found);
                    supabase(line, file, number, found);
                    knex(line, file, number, found);
                    repository(line, file, number, found);
                }
            }
            for (DataAccessFact fact : found) {
                facts.putIfAbsent(fact.table() + ":" + fact.operation() + ":" + fact.line(), fact);
            }
        }
        if (!facts.isEmpty()) {
            log.debug("{}: {} data access facts", file, facts.size());
        }
        return List.copyOf(facts.values());
    }

    private void sql(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = SQL_SELECT.matcher(line);
        if (m.find()) {
            found.add(fact(m.group(2), columns(m.group(1)), DataOperation.READ, file, number, 0.9));
        }
        m = SQL_INSERT.matcher(line);
        if (m.find()) {
            found.add(fact(m.group(1), m.group(2) != null ? columns(m.group(2)) : List.of(), DataOperation.WRITE,
                    file, number, 0.9));
        }
        m = SQL_UPDATE.matcher(line);
        if (m.find()) {
            List<String> assigned = new ArrayList<>();
            Matcher column = ASSIGNED_COLUMN.matcher(m.group(2).split("(?i)\\bWHERE\\b")[0]);
            while (column.find()) {
                assigned.add(column.group(1).toLowerCase());
            }
            found.add(fact(m.group(1), assigned, DataOperation.WRITE, file, number, 0.9));
        }
        m = SQL_DELETE.matcher(line);
        if (m.find()) {
            found.add(fact(m.group(1), List.of(), DataOperation.DELETE, file, number, 0.9));
        }
    }

    private void repository(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = REPOSITORY_CALL.matcher(line);
        while (m.find()) {
            String entity = m.group(1).replaceAll("(?i)(repository|repo|dao)$", "");
            String method = m.group(2);
            if (entity.replace("_", "").isEmpty()) {
                continue;
            }
            DataOperation operation = null;
            List<String> fields = List.of();
            if (REPOSITORY_READS.contains(method)) {
                operation = DataOperation.READ;
            } else if (REPOSITORY_WRITES.contains(method)) {
                operation = DataOperation.WRITE;
            } else if (REPOSITORY_DELETES.contains(method)) {
                operation = DataOperation.DELETE;
            } else {
                for (String prefix : DERIVED_QUERY_PREFIXES) {
                    if (method.startsWith(prefix) && method.length() > prefix.length()) {
                        operation = prefix.startsWith("delete") || prefix.startsWith("remove")
                                ? DataOperation.DELETE : DataOperation.READ;
                        fields = derivedQueryFields(method.substring(prefix.length()));
                        break;
                    }
                }
            }
            if (operation != null) {
                found.add(fact(entity, fields, operation, file, number, 0.95));
            }
        }
    }

    private void entityManager(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = ENTITY_MANAGER_CALL.matcher(line);
        while (m.find()) {
            if (m.group(3) == null) {
                continue;
            }
            DataOperation operation = switch (m.group(2)) {
                case "persist", "merge" -> DataOperation.WRITE;
                case "remove" -> DataOperation.DELETE;
                default -> DataOperation.READ;
            };
            // find(User.class, id) names the entity; persist(user) only suggests it
            found.add(fact(m.group(3), List.of(), operation, file, number, m.group(4) != null ? 0.9 : 0.7));
        }
    }

    private void django(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = DJANGO_CALL.matcher(line);
        while (m.find()) {
            String method = m.group(2);
            DataOperation operation = DJANGO_READS.contains(method) ? DataOperation.READ
                    : DJANGO_WRITES.contains(method) ? DataOperation.WRITE
                    : method.equals("delete") ? DataOperation.DELETE : null;
            if (operation == null) {
                continue;
            }
            List<String> fields = new ArrayList<>();
            Matcher argument = KEYWORD_ARGUMENT.matcher(m.group(3));
            while (argument.find()) {
                if (!fields.contains(argument.group(1))) {
                    fields.add(argument.group(1));
                }
            }
            found.add(fact(m.group(1), fields, operation, file, number, 0.9));
        }
    }

    private void sqlAlchemy(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = SQLALCHEMY_QUERY.matcher(line);
        while (m.find()) {
            found.add(fact(m.group(1), List.of(), DataOperation.READ, file, number, 0.9));
        }
    }

    private void prisma(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = PRISMA_CALL.matcher(line);
        while (m.find()) {
            String model = m.group(1);
            String method = m.group(2);
            if (model.startsWith("$")) {
                continue;
            }
            DataOperation operation = PRISMA_READS.contains(method) ? DataOperation.READ
                    : PRISMA_WRITES.contains(method) ? DataOperation.WRITE
                    : PRISMA_DELETES.contains(method) ? DataOperation.DELETE : null;
            if (operation == null) {
                continue;
            }
            List<String> fields = new ArrayList<>();
            Matcher where = WHERE_KEYS.matcher(line.substring(m.end()));
            if (where.find()) {
                for (String entry : where.group(1).split(",")) {
                    String key = entry.split(":")[0].trim();
                    if (key.matches("\\w+")) {
                        fields.add(snakeCase(key));
                    }
                }
            }
            found.add(fact(model, fields, operation, file, number, 0.95));
        }
    }

    private void supabase(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = SUPABASE_CALL.matcher(line);
        while (m.find()) {
            DataOperation operation = switch (m.group(2)) {
                case "select" -> DataOperation.READ;
                case "delete" -> DataOperation.DELETE;
                default -> DataOperation.WRITE;
            };
            List<String> fields = m.group(3) != null && operation == DataOperation.READ ? columns(m.group(3))
                    : List.of();
            found.add(fact(m.group(1), fields, operation, file, number, 0.95));
        }
    }

    private void knex(String line, String file, int number, List<DataAccessFact> found) {
        Matcher m = KNEX_CALL.matcher(line);
        while (m.find()) {
            String method = m.group(2) != null ? m.group(2) : "";
            DataOperation operation = switch (method) {
                case "insert", "update", "upsert" -> DataOperation.WRITE;
                case "del", "delete" -> DataOperation.DELETE;
                default -> DataOperation.READ;
            };
            found.add(fact(m.group(1), List.of(), operation, file, number, 0.85));
        }
    }

    private static DataAccessFact fact(String rawTable, List<String> fields, DataOperation operation, String file,
                                       int line, double confidence) {
        return new DataAccessFact(tableName(rawTable), fields, operation, file, line, confidence);
    }

    /**
     * {@code EmailAndStatusOrderByCreatedAt} becomes {@code [email, status]}.
     */
    static List<String> derivedQueryFields(String criteria) {
        String trimmed = criteria.replaceAll("OrderBy.*$", "")
                .replaceAll("Distinct$", "")
                .replaceAll("(?:First|Top)\\d*$", "");
        List<String> fields = new ArrayList<>();
        for (String part : trimmed.split("(?:And|Or)(?=[A-Z])")) {
            String field = DERIVED_SUFFIX.matcher(part).replaceAll("");
            if (!field.isEmpty()) {
                fields.add(snakeCase(field));
            }
        }
        return fields;
    }

    /**
     * Plural snake case without schema prefix or framework suffix: {@code UserProfile} becomes
     * {@code user_profiles}, {@code public.orders} stays {@code orders}.
     */
    static String tableName(String raw) {
        String name = raw.substring(raw.lastIndexOf('.') + 1)
                .replaceAll("^_+", "")
                .replaceAll("(?i)(Repository|Repo|Model|Entity|DAO)$", "");
        String snake = snakeCase(name);
        return snake.endsWith("s") ? snake : snake + "s";
    }

    static String snakeCase(String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }

    private static List<String> columns(String list) {
        List<String> columns = new ArrayList<>();
        for (String part : list.split(",")) {
            String column = part.trim().replaceAll("[\"'`\\[\\]]", "");
            column = column.replaceAll("(?i)\\s+AS\\s+\\w+$", "");
            column = column.substring(column.lastIndexOf('.') + 1);
            if (column.matches("[A-Za-z_]\\w*") && !column.equalsIgnoreCase("distinct")) {
                columns.add(column.toLowerCase());
            }
        }
        return columns;
    }

    private static boolean commentLine(String line, Language language) {
        String trimmed = line.trim();
        if (language == Language.PYTHON) {
            return trimmed.startsWith("#");
        }
        return trimmed.startsWith("//") || trimmed.startsWith("*") || trimmed.startsWith("/*");
    }
}
