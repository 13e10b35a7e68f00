package com.variantforge.document;

import com.variantforge.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    @Test
    void flagsStayWithinTheirOwnSubEntry() {
        String entry = Fixtures.lines(
            "\"E\" = VfxSystemDefinitionData {",
            "    complexEmitterDefinitionData: list[pointer] = {",
            "        VfxEmitterDefinitionData {",
            "            emitterName: string = \"First\"",
            "            stencilMode: u8 = 3",
            "            renderPhaseOverride: u8 = 4",
            "        }",
            "        VfxEmitterDefinitionData {",
            "            emitterName: string = \"Second\"",
            "            isGroundLayer: bool = false",
            "        }",
            "    }",
            "}");
        List<SubEntry> subs = extractor.extractSubEntries(entry);
        assertEquals(2, subs.size());
        assertTrue(subs.get(0).isHasDiscriminator());
        assertTrue(subs.get(0).isHasOverride());
        assertFalse(subs.get(1).isHasDiscriminator());
        assertFalse(subs.get(1).isHasOverride());
        assertFalse(subs.get(1).isHasExclusionFlag());
        assertEquals(2, subs.get(0).getStartLine());
        assertEquals(6, subs.get(0).getEndLine());
    }

    @Test
    void namesComeFromPropertyThenIdentifierThenPosition() {
        String entry = Fixtures.lines(
            "\"E\" = SystemX {",
            "    \"e1\" = EmitterY {",
            "        rate: u8 = 1",
            "    }",
            "    VfxEmitterDefinitionData {",
            "        rate: u8 = 1",
            "    }",
            "    \"e3\" = EmitterY {",
            "        emitterName: string = \"Named\"",
            "    }",
            "}");
        List<SubEntry> subs = extractor.extractSubEntries(entry);
        assertEquals(3, subs.size());
        assertEquals("e1", subs.get(0).getName());
        assertFalse(subs.get(0).isNameDeclared());
        assertEquals("VfxEmitterDefinitionData#2", subs.get(1).getName());
        assertNull(subs.get(1).getIdentifierToken());
        assertEquals("Named", subs.get(2).getName());
        assertTrue(subs.get(2).isNameDeclared());
        assertEquals("e3", subs.get(2).getIdentifier());
    }

    @Test
    void entryHeaderIsNeverItsOwnSubEntry() {
        String entry = Fixtures.lines(
            "\"E\" = EmitterGroup {",
            "    EmitterY {",
            "        emitterName: string = \"Inner\"",
            "    }",
            "}");
        List<SubEntry> subs = extractor.extractSubEntries(entry);
        assertEquals(1, subs.size());
        assertEquals("Inner", subs.get(0).getName());
    }

    @Test
    void exclusionFlagNeedsBooleanTrue() {
        Document document = new DocumentReader(extractor).read(Fixtures.load("skin0.py"));
        List<SubEntry> subs = document.getEntries().get(0).getSubEntries();
        assertFalse(subs.get(0).isHasExclusionFlag());
        assertTrue(subs.get(1).isHasExclusionFlag());
    }

    @Test
    void numericAttributeIsCaptured() {
        Document document = new DocumentReader(extractor).read(Fixtures.load("skin0.py"));
        SubEntry spark = document.find("0x1a2b3c4d").orElseThrow().getSubEntries().get(0);
        assertEquals(Map.of("blendMode", 4L), spark.getNumericAttributes());
        assertTrue(spark.isHasDiscriminator());
    }

    @Test
    void assetReferencesAreDistinctAndCaseInsensitive() {
        String text = Fixtures.lines(
            "a: string = \"ASSETS/x/one.TEX\"",
            "b: string = \"ASSETS/x/one.TEX\"",
            "c: string = \"ASSETS/y/two.dds\"",
            "d: string = \"ASSETS/y/readme.txt\"");
        List<AssetReference> refs = extractor.findAssetReferences(text);
        assertEquals(2, refs.size());
        assertEquals("ASSETS/x/one.TEX", refs.get(0).getOriginalPath());
        assertEquals("two.dds", refs.get(1).getFilename());
    }

    @Test
    void variantStateFromSuffixes() {
        String partial = Fixtures.lines(
            "\"E\" = Sys {",
            "    EmitterY {",
            "        emitterName: string = \"Bolt_Variant1\"",
            "    }",
            "}");
        String pair = Fixtures.lines(
            "\"E\" = Sys {",
            "    EmitterY {",
            "        emitterName: string = \"Bolt_Variant1\"",
            "    }",
            "    EmitterY {",
            "        emitterName: string = \"Bolt_Variant2\"",
            "    }",
            "}");
        DocumentReader reader = new DocumentReader(extractor);
        assertEquals(VariantState.INLINE_PARTIAL, reader.readEntry(partial).orElseThrow().getVariantState());
        assertEquals(VariantState.INLINE_PAIR, reader.readEntry(pair).orElseThrow().getVariantState());
        assertTrue(VariantState.INLINE_PAIR.hasVariantB());
    }

    @Test
    void dispatchNamesWithoutChildSetAreNotADispatcher() {
        String entry = Fixtures.lines(
            "\"E\" = Sys {",
            "    EmitterY {",
            "        emitterName: string = \"variant1\"",
            "    }",
            "    EmitterY {",
            "        emitterName: string = \"variant2\"",
            "    }",
            "}");
        assertEquals(VariantState.NONE, new DocumentReader(extractor).readEntry(entry).orElseThrow().getVariantState());
    }

    @Test
    void customSuffixesChangeDetection() {
        EntityExtractor custom = extractor.withMarkers(VariantMarkers.defaults().withSuffixes("_V1", "_V2"));
        String entry = Fixtures.lines(
            "\"E\" = Sys {",
            "    EmitterY {",
            "        emitterName: string = \"Bolt_V1\"",
            "    }",
            "}");
        assertEquals(VariantState.INLINE_PARTIAL, new DocumentReader(custom).readEntry(entry).orElseThrow().getVariantState());
        assertEquals(VariantState.NONE, new DocumentReader(extractor).readEntry(entry).orElseThrow().getVariantState());
    }
}
