package net.legacy.unit.annotation.util;

import lombok.experimental.UtilityClass;
import org.reflections.Reflections;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;

import java.lang.annotation.Annotation;
import java.util.Set;

/**
 * Utility class for scanning and retrieving classes annotated with a specified annotation.
 *
 * @author qwq-dev
 * @version 1.3
 * @since 2024-12-19 17:00
 */
@UtilityClass
public class AnnotationScanner {

    /**
     * Finds a set of classes annotated with the specified annotation within the given package and its sub-packages.
     *
     * <p>Only classes located in {@code basePackage} are returned, even when the classpath
     * roots containing that package hold other packages as well. Sibling packages sharing
     * the name as a prefix are excluded. Subclasses of an annotated class are returned only
     * if the annotation is {@link java.lang.annotation.Inherited}.
     *
     * @param basePackage     the base package to scan for annotated classes
     * @param annotationClass the annotation class to look for
     * @param classLoaders    optional class loaders to use for classpath scanning; if not provided, the default class loader is used
     * @return a set of classes annotated with the specified annotation
     */
    public static Set<Class<?>> findAnnotatedClasses(String basePackage, Class<? extends Annotation> annotationClass, ClassLoader... classLoaders) {
        ConfigurationBuilder configuration = new ConfigurationBuilder()
                .setUrls(ClasspathHelper.forPackage(basePackage, classLoaders))
                .filterInputsBy(new FilterBuilder().includePackage(basePackage + "."));

        if (classLoaders.length > 0) {
            configuration.addClassLoaders(classLoaders);
        }

        return new Reflections(configuration).getTypesAnnotatedWith(annotationClass, true);
    }

}
