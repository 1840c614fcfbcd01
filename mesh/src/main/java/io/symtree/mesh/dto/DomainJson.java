// file: src/main/java/io/symtree/mesh/dto/DomainJson.java
package io.symtree.mesh.dto;

import java.util.List;

public class DomainJson {
    public String name;
    public String submesh;
    public List<VariableJson> variables;
}
