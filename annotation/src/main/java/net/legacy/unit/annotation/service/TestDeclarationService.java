package net.legacy.unit.annotation.service;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;
import net.legacy.unit.annotation.util.AnnotationScanner;
import net.legacy.unit.foundation.registry.TestProcedure;
import net.legacy.unit.foundation.registry.TestRegistry;
import net.legacy.unit.foundation.util.TestLogger;
import net.legacy.unit.foundation.util.ValidationUtil;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Default {@link TestDeclarationServiceInterface} implementation based on reflection.
 *
 * <p>Suites and their methods are visited in name order, so the same set of declarations
 * always registers in the same order and reports the same collision first.
 *
 * @author qwq-dev
 * @version 1.0
 * @see TestSuite
 * @see UnitTest
 * @since 2025-06-15 09:30
 */
public class TestDeclarationService implements TestDeclarationServiceInterface {
    private static final String MODULE_NAME = "annotation";

    /**
     * {@inheritDoc}
     *
     * @param builder      {@inheritDoc}
     * @param suiteClasses {@inheritDoc}
     */
    @Override
    public void registerSuites(TestRegistry.Builder builder, Collection<Class<?>> suiteClasses) {
        ValidationUtil.requireNonNull(builder, "builder cannot be null");
        ValidationUtil.requireNonNull(suiteClasses, "suite classes cannot be null");

        suiteClasses.stream()
                .sorted(Comparator.comparing(Class::getName))
                .forEach(suiteClass -> registerSuite(builder, suiteClass));
    }

    /**
     * {@inheritDoc}
     *
     * @param builder      {@inheritDoc}
     * @param basePackages {@inheritDoc}
     * @param classLoaders {@inheritDoc}
     * @return {@inheritDoc}
     */
    @Override
    public List<Class<?>> registerPackages(TestRegistry.Builder builder, List<String> basePackages, ClassLoader... classLoaders) {
        ValidationUtil.requireNonNull(basePackages, "base packages cannot be null");

        Set<Class<?>> suiteClasses = new TreeSet<>(Comparator.comparing(Class::getName));
        for (String basePackage : basePackages) {
            ValidationUtil.requireNotBlank(basePackage, "base package cannot be blank");

            Set<Class<?>> found = AnnotationScanner.findAnnotatedClasses(basePackage, TestSuite.class, classLoaders);
            TestLogger.logInfo(MODULE_NAME, "Found %d suite(s) in package %s", found.size(), basePackage);
            suiteClasses.addAll(found);
        }

        List<Class<?>> ordered = List.copyOf(suiteClasses);
        registerSuites(builder, ordered);
        return ordered;
    }

    private void registerSuite(TestRegistry.Builder builder, Class<?> suiteClass) {
        TestSuite testSuite = suiteClass.getAnnotation(TestSuite.class);

        if (testSuite == null) {
            throw new TestDeclarationException(suiteClass.getName() + " is not annotated with @TestSuite");
        }

        if (!testSuite.enabled()) {
            TestLogger.logInfo(MODULE_NAME, "Skipping disabled suite %s", suiteClass.getName());
            return;
        }

        List<Method> testMethods = Arrays.stream(suiteClass.getDeclaredMethods())
                .filter(method -> method.isAnnotationPresent(UnitTest.class))
                .sorted(Comparator.comparing(Method::getName))
                .collect(Collectors.toList());

        TestLogger.logDebug(MODULE_NAME, "Registering %d test(s) from %s%s", testMethods.size(), suiteClass.getName(),
                testSuite.description().isEmpty() ? "" : " (" + testSuite.description() + ")");

        for (Method method : testMethods) {
            UnitTest unitTest = method.getAnnotation(UnitTest.class);
            String testName = unitTest.value().isEmpty() ? method.getName() : unitTest.value();
            builder.register(testName, createProcedure(suiteClass, method));
        }
    }

    /**
     * Validates a test method and wraps it into a procedure.
     *
     * <p>The resulting procedure rethrows whatever the test body throws, unwrapped from
     * reflection, so the runner can classify it.
     */
    private TestProcedure createProcedure(Class<?> suiteClass, Method method) {
        String methodName = suiteClass.getName() + "#" + method.getName();

        if (method.getParameterCount() != 0) {
            throw new TestDeclarationException("Test method " + methodName + " must not take parameters");
        }

        if (method.getReturnType() != void.class) {
            throw new TestDeclarationException("Test method " + methodName + " must return void");
        }

        method.setAccessible(true);

        if (Modifier.isStatic(method.getModifiers())) {
            return () -> invoke(method, null);
        }

        if (Modifier.isAbstract(suiteClass.getModifiers()) || suiteClass.isInterface()) {
            throw new TestDeclarationException("Test method " + methodName
                    + " is an instance method of an abstract suite");
        }

        if (suiteClass.isMemberClass() && !Modifier.isStatic(suiteClass.getModifiers())) {
            throw new TestDeclarationException("Test method " + methodName
                    + " is an instance method of an inner suite class, declare the suite static");
        }

        Constructor<?> constructor;
        try {
            constructor = suiteClass.getDeclaredConstructor();
        } catch (NoSuchMethodException exception) {
            throw new TestDeclarationException("Suite " + suiteClass.getName()
                    + " needs a no-argument constructor for instance test " + method.getName(), exception);
        }

        constructor.setAccessible(true);
        return () -> invoke(method, constructor);
    }

    private static void invoke(Method method, Constructor<?> constructor) throws Throwable {
        try {
            method.invoke(constructor != null ? constructor.newInstance() : null);
        } catch (InvocationTargetException exception) {
            throw exception.getCause();
        }
    }
}
