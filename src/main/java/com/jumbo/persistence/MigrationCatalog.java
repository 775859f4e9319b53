package com.jumbo.persistence;

import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds schema scripts on the classpath laid out as
 * {@code db/migrations/{namespace}/V{version}__{description}.sql}.
 */
public class MigrationCatalog {

    public static final String DEFAULT_LOCATION = "classpath*:db/migrations/*/V*__*.sql";

    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+)__(.+)\\.sql$");

    private final ResourcePatternResolver resolver;
    private final String location;

    public MigrationCatalog() {
        this(new PathMatchingResourcePatternResolver(), DEFAULT_LOCATION);
    }

    public MigrationCatalog(ResourcePatternResolver resolver, String location) {
        this.resolver = resolver;
        this.location = location;
    }

    public List<NamespaceMigrations> discover() {
        Map<String, List<Migration>> byNamespace = new TreeMap<>();
        try {
            for (Resource resource : resolver.getResources(location)) {
                String fileName = resource.getFilename();
                Matcher matcher = fileName == null ? null : SCRIPT_NAME.matcher(fileName);
                if (matcher == null || !matcher.matches()) {
                    continue;
                }
                Migration migration = new Migration(
                    Integer.parseInt(matcher.group(1)),
                    matcher.group(2).replace('_', ' '),
                    resource);
                byNamespace.computeIfAbsent(namespaceOf(resource), ns -> new ArrayList<>()).add(migration);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to scan migrations at " + location, ex);
        }

        return byNamespace.entrySet().stream()
            .map(entry -> new NamespaceMigrations(entry.getKey(), entry.getValue()))
            .toList();
    }

    private static String namespaceOf(Resource resource) throws IOException {
        String[] segments = resource.getURL().toString().split("/");
        return segments[segments.length - 2];
    }
}
