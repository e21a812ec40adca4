package net.legacy.unit.annotation.hierarchy.base;

public class ExtendedSuite extends BaseSuite {
}
