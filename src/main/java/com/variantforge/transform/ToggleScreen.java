package com.variantforge.transform;

import com.variantforge.document.Document;
import com.variantforge.document.Entry;
import com.variantforge.document.FormatProfile;
import com.variantforge.document.PropertyBag;

import java.util.Optional;

/**
 * The toggle screen: a single full-screen mesh Entry that writes the shared reference id, so the
 * A and B copies of every variant have something to compare against. A document holds at most one.
 */
public final class ToggleScreen {

    public static final String KEY = "togglescreen";
    public static final String DEFAULT_TEXTURE = "assets/togglescreen/screen.dds";
    public static final String DEFAULT_MESH = "assets/togglescreen/screen.scb";

    static final String TYPE_TAG = "VfxSystemDefinitionData";
    static final String SUB_TYPE_TAG = "VfxEmitterDefinitionData";
    static final int MODE = 1;
    static final String FLAGS = "6";

    private ToggleScreen() {
    }

    /**
     * Matches by key, or by name or path property when the key was hashed.
     */
    public static boolean isToggleScreen(Entry entry) {
        if (entry == null) {
            return false;
        }
        if (KEY.equalsIgnoreCase(entry.getIdentifier())) {
            return true;
        }
        PropertyBag bag = PropertyBag.of(entry.getText());
        return bag.getString("particleName").map(KEY::equalsIgnoreCase).orElse(false)
            || bag.getString("particlePath").map(KEY::equalsIgnoreCase).orElse(false);
    }

    public static Optional<Entry> find(Document document) {
        return document.getEntries().stream().filter(ToggleScreen::isToggleScreen).findFirst();
    }

    /** The reference id as written, e.g. {@code 0xe6deedc4} or {@code "name"}. */
    public static Optional<String> referenceId(Entry entry, String referenceProperty) {
        return PropertyBag.of(entry.getText()).get(referenceProperty)
            .map(PropertyBag.Property::value)
            .filter(v -> !v.isBlank());
    }

    static String render(String indent, Discriminator discriminator, String texturePath, String meshPath) {
        String i1 = indent + BlockEditor.INDENT_STEP;
        String i2 = i1 + BlockEditor.INDENT_STEP;
        String i3 = i2 + BlockEditor.INDENT_STEP;
        String i4 = i3 + BlockEditor.INDENT_STEP;
        String i5 = i4 + BlockEditor.INDENT_STEP;
        StringBuilder sb = new StringBuilder();
        sb.append(indent).append(FormatProfile.quote(KEY)).append(" = ").append(TYPE_TAG).append(" {\n");
        sb.append(i1).append("complexEmitterDefinitionData: list[pointer] = {\n");
        sb.append(i2).append(SUB_TYPE_TAG).append(" {\n");
        appendConstant(sb, i3, "rate", "1");
        appendConstant(sb, i3, "particleLifetime", "-1");
        appendConstant(sb, i3, "bindWeight", "1");
        sb.append(i3).append("isSingleParticle: flag = true\n");
        sb.append(i3).append("emitterName: string = \"Overlay_Under\"\n");
        sb.append(i3).append("primitive: pointer = VfxPrimitiveMesh {\n");
        sb.append(i4).append("mMesh: embed = VfxMeshDefinitionData {\n");
        sb.append(i5).append("mSimpleMeshName: string = ").append(FormatProfile.quote(meshPath)).append('\n');
        sb.append(i4).append("}\n");
        sb.append(i4).append("AlignPitchToCamera: bool = true\n");
        sb.append(i4).append("AlignYawToCamera: bool = true\n");
        sb.append(i3).append("}\n");
        sb.append(i3).append("pass: i16 = -9999\n");
        sb.append(i3).append("blendMode: u8 = 4\n");
        for (String line : discriminator.render(MODE)) {
            sb.append(i3).append(line).append('\n');
        }
        sb.append(i3).append("birthRotation0: embed = ValueVector3 {\n");
        sb.append(i4).append("constantValue: vec3 = { 0, -270, 0 }\n");
        sb.append(i3).append("}\n");
        sb.append(i3).append("texture: string = ").append(FormatProfile.quote(texturePath)).append('\n');
        sb.append(i2).append("}\n");
        sb.append(i1).append("}\n");
        sb.append(i1).append("visibilityRadius: f32 = ").append(DispatcherTemplate.VISIBILITY_RADIUS).append('\n');
        sb.append(i1).append("particleName: string = ").append(FormatProfile.quote(KEY)).append('\n');
        sb.append(i1).append("particlePath: string = ").append(FormatProfile.quote(KEY)).append('\n');
        sb.append(i1).append("flags: u16 = ").append(FLAGS).append('\n');
        sb.append(indent).append('}');
        return sb.toString();
    }

    private static void appendConstant(StringBuilder sb, String indent, String name, String value) {
        sb.append(indent).append(name).append(": embed = ValueFloat {\n");
        sb.append(indent).append(BlockEditor.INDENT_STEP).append("constantValue: f32 = ").append(value).append('\n');
        sb.append(indent).append("}\n");
    }
}
