package celestial.bodies;

/**
 * 天体分类标签
 *
 * 与数值计算无关的分类元数据，以集合形式附在 {@link BodyDescriptor} 上。
 */
public enum BodyCapability {
    SOLAR_SYSTEM_OBJECT,
    STAR,
    POINT_SOURCE,
    DEEP_SKY_OBJECT,
    EXTENDED_OBJECT,
    PLANET,
    DWARF_PLANET,
    MINOR_PLANET,
    COMET,
    SATELLITE
}
