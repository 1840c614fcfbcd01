// file: src/main/java/io/symtree/mesh/dto/GeometryJson.java
package io.symtree.mesh.dto;

import java.util.List;

public class GeometryJson {
    public List<DomainJson> domains;
}
