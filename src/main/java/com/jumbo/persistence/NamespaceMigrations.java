package com.jumbo.persistence;

import java.util.Comparator;
import java.util.List;

/**
 * The migrations owned by one projection namespace, ordered by version.
 */
public record NamespaceMigrations(String namespace, List<Migration> migrations) {

    public NamespaceMigrations {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace is required");
        }
        migrations = migrations.stream()
            .sorted(Comparator.comparingInt(Migration::version))
            .toList();
        for (int i = 1; i < migrations.size(); i++) {
            if (migrations.get(i).version() == migrations.get(i - 1).version()) {
                throw new IllegalArgumentException("duplicate migration version "
                    + migrations.get(i).version() + " in namespace " + namespace);
            }
        }
    }

    public static NamespaceMigrations of(String namespace, Migration... migrations) {
        return new NamespaceMigrations(namespace, List.of(migrations));
    }
}
