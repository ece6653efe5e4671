package io.routedoc.core.model;

/**
 * Document-level metadata. Title and version default to {@code ""}.
 *
 * @param title       API title
 * @param version     API version
 * @param description description, or null
 * @param license     license name, or null
 */
public record Info(String title, String version, String description, String license) {

    private static final Info EMPTY = new Info("", "", null, null);

    public Info {
        title = title != null ? title : "";
        version = version != null ? version : "";
    }

    public static Info empty() {
        return EMPTY;
    }

    public Info withTitle(String title) {
        return new Info(title, version, description, license);
    }

    public Info withVersion(String version) {
        return new Info(title, version, description, license);
    }

    public Info withDescription(String description) {
        return new Info(title, version, description, license);
    }

    public Info withLicense(String license) {
        return new Info(title, version, description, license);
    }
}
