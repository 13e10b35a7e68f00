package com.variantforge.transform;

import com.variantforge.document.FormatProfile;
import com.variantforge.document.VariantMarkers;

/**
 * Renders the small Entry that replaces a detached original: one dispatch element per sibling,
 * each pointing at its sibling by identifier through a child-set block.
 */
class DispatcherTemplate {

    static final String DEFAULT_SUB_ENTRY_TYPE = "VfxEmitterDefinitionData";
    static final String VISIBILITY_RADIUS = "9999";
    static final String FLAGS = "228";

    private final FormatProfile profile;
    private final VariantMarkers markers;

    DispatcherTemplate(FormatProfile profile, VariantMarkers markers) {
        this.profile = profile;
        this.markers = markers;
    }

    /**
     * @param indent      indentation of the original Entry header
     * @param identifier  the original Entry's identifier token, kept as written
     * @param key         unquoted identifier used for the name and path properties
     * @param typeTag     the original Entry's type tag
     * @param subTypeTag  type tag for the two dispatch elements
     */
    String render(String indent, String identifier, String key, String typeTag, String subTypeTag,
                  String siblingKeyA, String siblingKeyB) {
        String i1 = indent + BlockEditor.INDENT_STEP;
        String i2 = i1 + BlockEditor.INDENT_STEP;
        String sub = subTypeTag != null ? subTypeTag : DEFAULT_SUB_ENTRY_TYPE;
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(identifier).append(" = ").append(typeTag).append(" {\n");
        sb.append(i1).append("complexEmitterDefinitionData: list[pointer] = {\n");
        appendDispatchElement(sb, i2, sub, siblingKeyA, markers.getDispatchNameA());
        appendDispatchElement(sb, i2, sub, siblingKeyB, markers.getDispatchNameB());
        sb.append(i1).append("}\n");
        sb.append(i1).append("visibilityRadius: f32 = ").append(VISIBILITY_RADIUS).append('\n');
        sb.append(i1).append(profile.getEntryNameProperty()).append(": string = ")
            .append(FormatProfile.quote(lastSegment(key))).append('\n');
        sb.append(i1).append("particlePath: string = ").append(FormatProfile.quote(key)).append('\n');
        sb.append(i1).append("flags: u16 = ").append(FLAGS).append('\n');
        sb.append(indent).append('}');
        return sb.toString();
    }

    private void appendDispatchElement(StringBuilder sb, String indent, String typeTag, String siblingKey,
                                       String dispatchName) {
        String i1 = indent + BlockEditor.INDENT_STEP;
        String i2 = i1 + BlockEditor.INDENT_STEP;
        String i3 = i2 + BlockEditor.INDENT_STEP;
        String i4 = i3 + BlockEditor.INDENT_STEP;
        sb.append(indent).append(typeTag).append(" {\n");
        appendConstant(sb, i1, "rate", "1");
        appendConstant(sb, i1, "particleLifetime", "-1");
        appendConstant(sb, i1, "bindWeight", "1");
        sb.append(i1).append(markers.getChildSetProperty())
            .append(": pointer = VfxChildParticleSetDefinitionData {\n");
        sb.append(i2).append("childrenIdentifiers: list[embed] = {\n");
        sb.append(i3).append("VfxChildIdentifier {\n");
        sb.append(i4).append("effectKey: hash = ").append(FormatProfile.quote(siblingKey)).append('\n');
        sb.append(i3).append("}\n");
        sb.append(i2).append("}\n");
        sb.append(i1).append("}\n");
        sb.append(i1).append("isSingleParticle: flag = true\n");
        sb.append(i1).append(profile.getSubEntryNameProperty()).append(": string = ")
            .append(FormatProfile.quote(dispatchName)).append('\n');
        sb.append(indent).append("}\n");
    }

    private static void appendConstant(StringBuilder sb, String indent, String name, String value) {
        sb.append(indent).append(name).append(": embed = ValueFloat {\n");
        sb.append(indent).append(BlockEditor.INDENT_STEP).append("constantValue: f32 = ").append(value).append('\n');
        sb.append(indent).append("}\n");
    }

    static String lastSegment(String key) {
        int slash = key.lastIndexOf('/');
        String tail = slash >= 0 ? key.substring(slash + 1) : key;
        return tail.isEmpty() ? key : tail;
    }
}
