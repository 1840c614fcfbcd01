// file: src/main/java/io/symtree/mesh/dto/VariableJson.java
package io.symtree.mesh.dto;

public class VariableJson {
    public String name;
    public String coordSys = "cartesian";
    public double min;
    public double max;
    public int points;
}
