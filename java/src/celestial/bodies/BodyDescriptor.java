package celestial.bodies;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 天体描述
 *
 * 名称、类别和分类标签。名称的小写形式同时作为星历上下文中位置表的名称。
 */
public final class BodyDescriptor implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final BodyDescriptor SUN = new BodyDescriptor("Sun", BodyKind.SUN,
        EnumSet.of(BodyCapability.SOLAR_SYSTEM_OBJECT, BodyCapability.STAR));
    public static final BodyDescriptor MOON = new BodyDescriptor("Moon", BodyKind.MOON,
        EnumSet.of(BodyCapability.SOLAR_SYSTEM_OBJECT, BodyCapability.SATELLITE));
    public static final BodyDescriptor MERCURY = planet("Mercury");
    public static final BodyDescriptor VENUS = planet("Venus");
    public static final BodyDescriptor EARTH = planet("Earth");
    public static final BodyDescriptor MARS = planet("Mars");
    public static final BodyDescriptor JUPITER = planet("Jupiter");
    public static final BodyDescriptor SATURN = planet("Saturn");
    public static final BodyDescriptor URANUS = planet("Uranus");
    public static final BodyDescriptor NEPTUNE = planet("Neptune");
    public static final BodyDescriptor PLUTO = new BodyDescriptor("Pluto", BodyKind.PLANET,
        EnumSet.of(BodyCapability.SOLAR_SYSTEM_OBJECT, BodyCapability.DWARF_PLANET));

    private final String name;
    private final BodyKind kind;
    private final Set<BodyCapability> capabilities;

    public BodyDescriptor(String name, BodyKind kind, Set<BodyCapability> capabilities) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.capabilities = capabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
    }

    private static BodyDescriptor planet(String name) {
        return new BodyDescriptor(name, BodyKind.PLANET,
            EnumSet.of(BodyCapability.SOLAR_SYSTEM_OBJECT, BodyCapability.PLANET));
    }

    public String getName() {
        return name;
    }

    public BodyKind getKind() {
        return kind;
    }

    public Set<BodyCapability> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(BodyCapability capability) {
        return capabilities.contains(capability);
    }

    /**
     * 星历上下文中的位置表名称
     */
    public String getTableName() {
        return name.toLowerCase(Locale.ROOT);
    }

    public boolean isEarth() {
        return this.equals(EARTH);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BodyDescriptor)) {
            return false;
        }
        BodyDescriptor that = (BodyDescriptor) o;
        return name.equals(that.name) && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, kind);
    }

    @Override
    public String toString() {
        return name;
    }
}
