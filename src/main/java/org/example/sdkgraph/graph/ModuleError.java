package org.example.sdkgraph.graph;

import java.util.Objects;

/**
 * A diagnostic recorded against one module while the pipeline runs.
 * Errors never stop the traversal; they fail the build once all passes finished.
 */
public class ModuleError {

    private final String moduleId;
    private final String property;
    private final String pass;
    private final String message;

    public ModuleError(String moduleId, String property, String pass, String message) {
        this.moduleId = Objects.requireNonNull(moduleId, "moduleId cannot be null");
        this.property = property;
        this.pass = pass;
        this.message = Objects.requireNonNull(message, "message cannot be null");
    }

    public static ModuleError moduleError(ModuleNode module, String pass, String message) {
        return new ModuleError(module.getId(), null, pass, message);
    }

    public static ModuleError propertyError(ModuleNode module, String property, String pass, String message) {
        return new ModuleError(module.getId(), property, pass, message);
    }

    public String getModuleId() {
        return moduleId;
    }

    /**
     * Returns the offending property, or null for module-level errors.
     */
    public String getProperty() {
        return property;
    }

    public String getPass() {
        return pass;
    }

    public String getMessage() {
        return message;
    }

    public boolean isPropertyError() {
        return property != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleError that = (ModuleError) o;
        return Objects.equals(moduleId, that.moduleId) &&
               Objects.equals(property, that.property) &&
               Objects.equals(pass, that.pass) &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleId, property, pass, message);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("module \"").append(moduleId).append("\"");
        if (pass != null) {
            sb.append(" [").append(pass).append("]");
        }
        sb.append(": ");
        if (property != null) {
            sb.append(property).append(": ");
        }
        sb.append(message);
        return sb.toString();
    }
}
