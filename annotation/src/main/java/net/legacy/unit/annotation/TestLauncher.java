package net.legacy.unit.annotation;

import lombok.experimental.UtilityClass;
import net.legacy.unit.annotation.service.TestDeclarationService;
import net.legacy.unit.annotation.service.TestDeclarationServiceInterface;
import net.legacy.unit.foundation.annotation.RunnerConfiguration;
import net.legacy.unit.foundation.registry.TestRegistry;
import net.legacy.unit.foundation.runner.RunnerSettings;
import net.legacy.unit.foundation.runner.TestRunner;
import net.legacy.unit.foundation.util.TestLogger;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Program entry point of the harness.
 *
 * <p>A launch has two strictly separated phases. First every declared test is registered;
 * any declaration problem aborts the launch before a single test runs. Then the registry is
 * handed to a {@link TestRunner} and the status code of the run is returned.
 *
 * <p>A test program usually consists of nothing more than:
 * <pre>{@code
 * public static void main(String[] args) {
 *     System.exit(TestLauncher.launch(ParserTests.class, LexerTests.class));
 * }
 * }</pre>
 *
 * <p>Alternatively, {@link #main(String...)} scans the packages given as arguments.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-15 10:00
 */
@UtilityClass
public class TestLauncher {
    private static final String MODULE_NAME = "launcher";
    private static final TestDeclarationServiceInterface DECLARATION_SERVICE = new TestDeclarationService();

    /**
     * Scans the packages named by {@code basePackages} for suites, runs them on
     * {@link System#out} and exits with the status code of the run.
     *
     * @param basePackages the packages to scan
     */
    public static void main(String... basePackages) {
        System.exit(launchPackages(System.out, Arrays.asList(basePackages)));
    }

    /**
     * Runs the given suites on {@link System#out}.
     *
     * @param suiteClasses the suite classes
     * @return the status code of the run
     */
    public static int launch(Class<?>... suiteClasses) {
        return launch(System.out, Arrays.asList(suiteClasses));
    }

    /**
     * Runs the given suites.
     *
     * <p>The runner settings are taken from the first suite carrying a
     * {@link RunnerConfiguration}, or the defaults if there is none.
     *
     * @param out          the stream receiving the report
     * @param suiteClasses the suite classes
     * @return the status code of the run
     */
    public static int launch(PrintStream out, Collection<Class<?>> suiteClasses) {
        TestRegistry.Builder builder = TestRegistry.builder();

        try {
            DECLARATION_SERVICE.registerSuites(builder, suiteClasses);
        } catch (RuntimeException exception) {
            TestLogger.logFailure(MODULE_NAME, "Failed to register tests", exception);
            throw exception;
        }

        return run(out, builder.build(), settingsOf(suiteClasses));
    }

    /**
     * Scans the given packages for suites and runs them.
     *
     * @param out          the stream receiving the report
     * @param basePackages the packages to scan
     * @return the status code of the run
     */
    public static int launchPackages(PrintStream out, List<String> basePackages) {
        if (basePackages.isEmpty()) {
            TestLogger.logWarning(MODULE_NAME, "No package to scan was given, the run will be empty");
        }

        TestRegistry.Builder builder = TestRegistry.builder();
        List<Class<?>> suiteClasses;

        try {
            suiteClasses = DECLARATION_SERVICE.registerPackages(builder, basePackages);
        } catch (RuntimeException exception) {
            TestLogger.logFailure(MODULE_NAME, "Failed to register tests from packages %s", exception, basePackages);
            throw exception;
        }

        return run(out, builder.build(), settingsOf(suiteClasses));
    }

    private static int run(PrintStream out, TestRegistry registry, RunnerSettings settings) {
        TestLogger.logInfo(MODULE_NAME, "Registered %d test(s)", registry.size());
        return new TestRunner(out, settings).run(registry);
    }

    private static RunnerSettings settingsOf(Collection<Class<?>> suiteClasses) {
        return RunnerSettings.from(suiteClasses.stream()
                .map(suiteClass -> suiteClass.getAnnotation(RunnerConfiguration.class))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null));
    }
}
