package com.variantforge.transform;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * The closed set of operations a caller can request against one document. Serialized with a
 * {@code kind} field naming the operation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = TransformRequest.InlineVariantPair.class, name = "INLINE_VARIANT_PAIR"),
    @JsonSubTypes.Type(value = TransformRequest.DetachedVariantPair.class, name = "DETACHED_VARIANT_PAIR"),
    @JsonSubTypes.Type(value = TransformRequest.DetachedVariantDocuments.class, name = "DETACHED_VARIANT_DOCUMENTS"),
    @JsonSubTypes.Type(value = TransformRequest.Reverse.class, name = "REVERSE_VARIANT"),
    @JsonSubTypes.Type(value = TransformRequest.AddProperty.class, name = "ADD_PROPERTY"),
    @JsonSubTypes.Type(value = TransformRequest.RemoveProperty.class, name = "REMOVE_PROPERTY"),
    @JsonSubTypes.Type(value = TransformRequest.InsertToggleScreen.class, name = "INSERT_TOGGLE_SCREEN")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TransformRequest {

    public enum Kind {
        INLINE_VARIANT_PAIR,
        DETACHED_VARIANT_PAIR,
        DETACHED_VARIANT_DOCUMENTS,
        REVERSE_VARIANT,
        ADD_PROPERTY,
        REMOVE_PROPERTY,
        INSERT_TOGGLE_SCREEN
    }

    public interface Visitor<R> {
        R visit(InlineVariantPair request);

        R visit(DetachedVariantPair request);

        R visit(DetachedVariantDocuments request);

        R visit(Reverse request);

        R visit(AddProperty request);

        R visit(RemoveProperty request);

        R visit(InsertToggleScreen request);
    }

    private List<String> identifiers = new ArrayList<>();

    @JsonIgnore
    public abstract Kind getKind();

    public abstract <R> R accept(Visitor<R> visitor);

    /** Identifiers of the Entries to operate on, unquoted. */
    public List<String> getIdentifiers() {
        return identifiers;
    }

    public void setIdentifiers(List<String> identifiers) {
        this.identifiers = identifiers != null ? new ArrayList<>(identifiers) : new ArrayList<>();
    }

    /** False for operations on the document as a whole. */
    @JsonIgnore
    public boolean needsIdentifiers() {
        return true;
    }

    /**
     * Optional per-request overrides of the configured variant settings. Null means "use the default".
     */
    public abstract static class VariantRequest extends TransformRequest {
        private String suffixA;
        private String suffixB;
        private String folderA;
        private String folderB;
        private String referenceId;

        public String getSuffixA() {
            return suffixA;
        }

        public void setSuffixA(String suffixA) {
            this.suffixA = suffixA;
        }

        public String getSuffixB() {
            return suffixB;
        }

        public void setSuffixB(String suffixB) {
            this.suffixB = suffixB;
        }

        public String getFolderA() {
            return folderA;
        }

        public void setFolderA(String folderA) {
            this.folderA = folderA;
        }

        public String getFolderB() {
            return folderB;
        }

        public void setFolderB(String folderB) {
            this.folderB = folderB;
        }

        public String getReferenceId() {
            return referenceId;
        }

        public void setReferenceId(String referenceId) {
            this.referenceId = referenceId;
        }

        /** Applies the non-null overrides on top of {@code base}. */
        public TransformParams.Builder overlay(TransformParams base) {
            return base.toBuilder()
                .suffixes(suffixA, suffixB)
                .folders(folderA, folderB)
                .referenceId(referenceId);
        }
    }

    public static class InlineVariantPair extends VariantRequest {
        private boolean skipExcluded;

        public boolean isSkipExcluded() {
            return skipExcluded;
        }

        public void setSkipExcluded(boolean skipExcluded) {
            this.skipExcluded = skipExcluded;
        }

        @Override
        public Kind getKind() {
            return Kind.INLINE_VARIANT_PAIR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class DetachedVariantPair extends VariantRequest {
        @Override
        public Kind getKind() {
            return Kind.DETACHED_VARIANT_PAIR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Detached pair whose siblings go to two secondary documents instead of the source document. */
    public static class DetachedVariantDocuments extends VariantRequest {
        @Override
        public Kind getKind() {
            return Kind.DETACHED_VARIANT_DOCUMENTS;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class Reverse extends VariantRequest {
        @Override
        public Kind getKind() {
            return Kind.REVERSE_VARIANT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class AddProperty extends TransformRequest {
        private String propertyLine;

        /** A full assignment such as {@code disableBackfaceCull: bool = true}. */
        public String getPropertyLine() {
            return propertyLine;
        }

        public void setPropertyLine(String propertyLine) {
            this.propertyLine = propertyLine;
        }

        @Override
        public Kind getKind() {
            return Kind.ADD_PROPERTY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    public static class RemoveProperty extends TransformRequest {
        private String propertyName;

        public String getPropertyName() {
            return propertyName;
        }

        public void setPropertyName(String propertyName) {
            this.propertyName = propertyName;
        }

        @Override
        public Kind getKind() {
            return Kind.REMOVE_PROPERTY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /** Adds the toggle screen Entry and its resolver record. Takes no identifiers. */
    public static class InsertToggleScreen extends TransformRequest {
        private String texturePath;
        private String meshPath;
        private String referenceId;

        public String getTexturePath() {
            return texturePath;
        }

        public void setTexturePath(String texturePath) {
            this.texturePath = texturePath;
        }

        public String getMeshPath() {
            return meshPath;
        }

        public void setMeshPath(String meshPath) {
            this.meshPath = meshPath;
        }

        public String getReferenceId() {
            return referenceId;
        }

        public void setReferenceId(String referenceId) {
            this.referenceId = referenceId;
        }

        @Override
        public boolean needsIdentifiers() {
            return false;
        }

        @Override
        public Kind getKind() {
            return Kind.INSERT_TOGGLE_SCREEN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
