package net.legacy.unit.annotation.service;

import net.legacy.unit.foundation.registry.TestRegistry;

import java.util.Collection;
import java.util.List;

/**
 * Service interface for turning annotated test declarations into registry entries.
 *
 * <p>Implementations read {@link net.legacy.unit.annotation.TestSuite} classes and register
 * each of their {@link net.legacy.unit.annotation.UnitTest} methods into a
 * {@link TestRegistry.Builder}. Registration happens entirely before any test runs.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-15 09:30
 */
public interface TestDeclarationServiceInterface {
    /**
     * Registers the tests of the given suite classes.
     *
     * @param builder      the registry builder receiving the tests
     * @param suiteClasses the suite classes, each annotated with {@link net.legacy.unit.annotation.TestSuite}
     * @throws TestDeclarationException if a suite or test method is declared incorrectly
     */
    void registerSuites(TestRegistry.Builder builder, Collection<Class<?>> suiteClasses);

    /**
     * Scans the given packages and their sub-packages for suites and registers their tests.
     *
     * @param builder      the registry builder receiving the tests
     * @param basePackages the packages to scan
     * @param classLoaders optional class loaders to use for classpath scanning; if not provided, the default class loader is used
     * @return the suite classes that were found, in name order
     * @throws TestDeclarationException if a suite or test method is declared incorrectly
     */
    List<Class<?>> registerPackages(TestRegistry.Builder builder, List<String> basePackages, ClassLoader... classLoaders);
}
