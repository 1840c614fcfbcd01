// file: src/main/java/io/symtree/core/dto/SettingsJson.java
package io.symtree.core.dto;

/** JSON shape of a settings file; every field is optional. */
public class SettingsJson {
    public Boolean debugMode;
    public String renderStyle;
}
