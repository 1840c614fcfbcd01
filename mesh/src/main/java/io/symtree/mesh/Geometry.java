// file: src/main/java/io/symtree/mesh/Geometry.java
package io.symtree.mesh;

import io.symtree.core.SpatialVariable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Geometry: domain name -> (spatial variable -> limits), in insertion order.
 * <p>
 * Variables are held by reference; the geometry never modifies them.
 */
public final class Geometry {

    private final Map<String, Map<SpatialVariable, Limits>> domains;

    private Geometry(Map<String, Map<SpatialVariable, Limits>> domains) {
        var copy = new LinkedHashMap<String, Map<SpatialVariable, Limits>>();
        domains.forEach((name, vars) -> copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(vars))));
        this.domains = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> domains() {
        return domains.keySet();
    }

    /**
     * Variables and limits of {@code domain}.
     *
     * @throws DomainException if the domain is not part of this geometry
     */
    public Map<SpatialVariable, Limits> variables(String domain) {
        var vars = domains.get(domain);
        if (vars == null) throw new DomainException("unknown domain: " + domain);
        return vars;
    }

    public static final class Builder {
        private final Map<String, Map<SpatialVariable, Limits>> domains = new LinkedHashMap<>();

        private Builder() {}

        public Builder add(String domain, SpatialVariable variable, Limits limits) {
            Objects.requireNonNull(domain, "domain");
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(limits, "limits");
            if (domain.isBlank()) throw new IllegalArgumentException("domain must not be blank");

            var vars = domains.computeIfAbsent(domain, d -> new LinkedHashMap<>());
            if (vars.containsKey(variable)) {
                throw new GeometryException("variable %s already has limits in domain %s".formatted(variable, domain));
            }
            vars.put(variable, limits);
            return this;
        }

        public Geometry build() {
            if (domains.isEmpty()) throw new GeometryException("geometry must contain at least one domain");
            return new Geometry(domains);
        }
    }
}
