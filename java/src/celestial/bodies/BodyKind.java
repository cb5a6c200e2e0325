package celestial.bodies;

/**
 * 天体类别，决定标准高度角和事件过滤策略
 */
public enum BodyKind {
    SUN,
    MOON,
    PLANET
}
