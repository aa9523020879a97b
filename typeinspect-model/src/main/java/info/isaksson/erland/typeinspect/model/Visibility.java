package info.isaksson.erland.typeinspect.model;

public enum Visibility {
    PUBLIC,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE
}
