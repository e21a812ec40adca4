package net.legacy.unit.annotation.util;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.fixture.mixed.MixedSuite;
import net.legacy.unit.annotation.hierarchy.base.BaseSuite;
import net.legacy.unit.annotation.hierarchy.baseline.BaselineSuite;
import net.legacy.unit.annotation.fixture.passing.ArithmeticSuite;
import net.legacy.unit.annotation.fixture.passing.DisabledSuite;
import net.legacy.unit.annotation.fixture.passing.StringSuite;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class AnnotationScannerTest {

    @Test
    public void findsAnnotatedClassesOfOnePackage() {
        Set<Class<?>> found = AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.fixture.passing", TestSuite.class);

        Assertions.assertEquals(Set.of(ArithmeticSuite.class, StringSuite.class, DisabledSuite.class), found);
    }

    @Test
    public void includesSubPackages() {
        Set<Class<?>> found = AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.fixture", TestSuite.class);

        Assertions.assertEquals(
                Set.of(ArithmeticSuite.class, StringSuite.class, DisabledSuite.class, MixedSuite.class), found);
    }

    @Test
    public void returnsNothingForPackageWithoutSuites() {
        Assertions.assertTrue(AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.nothing.here", TestSuite.class).isEmpty());
    }

    @Test
    public void skipsSubclassesOfAnnotatedClasses() {
        Set<Class<?>> found = AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.hierarchy.base", TestSuite.class);

        Assertions.assertEquals(Set.of(BaseSuite.class), found);
    }

    @Test
    public void excludesSiblingPackagesSharingThePrefix() {
        Set<Class<?>> found = AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.hierarchy", TestSuite.class);

        Assertions.assertEquals(Set.of(BaseSuite.class, BaselineSuite.class), found);
        Assertions.assertFalse(AnnotationScanner.findAnnotatedClasses(
                "net.legacy.unit.annotation.hierarchy.base", TestSuite.class).contains(BaselineSuite.class));
    }
}
