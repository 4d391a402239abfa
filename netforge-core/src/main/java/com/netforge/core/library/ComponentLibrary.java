package com.netforge.core.library;

import com.netforge.core.model.ComponentRole;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of component templates by kind.
 *
 * <p>Injected into the net builder instead of being held as process-wide state.
 * Kinds missing from the library behave as plain parts with an empty SPICE type
 * and a prefix derived from the kind's first character.
 */
public final class ComponentLibrary {

    private final Map<String, ComponentTemplate> byKind;

    private ComponentLibrary(Map<String, ComponentTemplate> byKind) {
        this.byKind = byKind;
    }

    /**
     * Creates a library; later templates replace earlier ones of the same kind.
     *
     * @param templates templates in load order
     * @return library
     */
    public static ComponentLibrary of(List<ComponentTemplate> templates) {
        Map<String, ComponentTemplate> map = new LinkedHashMap<>();
        for (ComponentTemplate template : templates) {
            map.remove(template.kind());
            map.put(template.kind(), template);
        }
        return new ComponentLibrary(Map.copyOf(map));
    }

    /**
     * Creates a library with no templates.
     *
     * @return empty library
     */
    public static ComponentLibrary empty() {
        return new ComponentLibrary(Map.of());
    }

    public Optional<ComponentTemplate> get(String kind) {
        return Optional.ofNullable(kind == null ? null : byKind.get(kind.trim()));
    }

    public ComponentRole roleOf(String kind) {
        return get(kind).map(ComponentTemplate::role).orElseGet(() ->
            ComponentTemplate.isGroundKind(kind) ? ComponentRole.NET_LABEL : ComponentRole.PART);
    }

    public String prefixFor(String kind) {
        return get(kind).map(ComponentTemplate::prefix).orElseGet(() -> ComponentTemplate.defaultPrefix(kind));
    }

    public String spiceTypeFor(String kind) {
        return get(kind).map(ComponentTemplate::spiceType).orElse("");
    }

    /**
     * Returns whether a kind ties its net to ground, either through its template
     * or, for unknown kinds, through its name.
     *
     * @param kind component kind
     * @return true for ground symbols
     */
    public boolean isGround(String kind) {
        return get(kind).map(ComponentTemplate::isGround).orElseGet(() -> ComponentTemplate.isGroundKind(kind));
    }

    /**
     * Returns templates sorted by category then display name.
     *
     * @return sorted templates
     */
    public List<ComponentTemplate> sorted() {
        List<ComponentTemplate> out = new ArrayList<>(byKind.values());
        out.sort(Comparator
            .comparing((ComponentTemplate t) -> t.category().toLowerCase(Locale.ROOT))
            .thenComparing(t -> t.displayName().toLowerCase(Locale.ROOT)));
        return out;
    }

    public int size() {
        return byKind.size();
    }
}
