package com.variantforge.xref;

import com.variantforge.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CrossReferenceUpdaterTest {

    private static final String ORB = "Characters/Ahri/Skins/Skin0/Particles/Ahri_Base_Q_Orb";

    private final CrossReferenceUpdater updater = new CrossReferenceUpdater();
    private final String source = Fixtures.load("skin0.py");

    @Test
    void readsRecordsAndLinkedFiles() {
        CrossReferenceTable table = updater.read(source);

        assertTrue(table.isResolverFound());
        assertTrue(table.isLinkedFound());
        assertEquals(Map.of(ORB, ORB), table.getRecords());
        assertEquals(List.of("DATA/Characters/Ahri/Ahri.bin"), table.getLinkedFiles());
        assertTrue(table.isLinked("data/characters/ahri/ahri.bin"));
    }

    @Test
    void addsRecordsBeforeTheClosingBraceAndSkipsExistingKeys() {
        Map<String, String> additions = new LinkedHashMap<>();
        additions.put(ORB, ORB);
        additions.put(ORB + "_child_variant1", ORB + "_child_variant1");

        XrefEdit edit = updater.addResolverRecords(source, additions);

        assertTrue(edit.isSectionFound());
        assertEquals(List.of(ORB + "_child_variant1"), edit.getApplied());
        assertEquals(List.of(ORB), edit.getSkipped());
        String expectedLine = "            \"" + ORB + "_child_variant1\" = \"" + ORB + "_child_variant1\"\n"
            + "        }\n";
        assertTrue(edit.getText().contains(expectedLine));
        assertEquals(2, updater.read(edit.getText()).getRecords().size());
    }

    @Test
    void singleLineSectionIsExpanded() {
        String text = Fixtures.lines(
            "linked: list[string] = {}",
            "entries: map[hash,embed] = {",
            "}");

        XrefEdit edit = updater.addLinkedFiles(text, List.of("DATA/variant1.bin", "data/VARIANT1.bin"));

        assertEquals(List.of("DATA/variant1.bin"), edit.getApplied());
        assertEquals(List.of("data/VARIANT1.bin"), edit.getSkipped());
        assertEquals(Fixtures.lines(
            "linked: list[string] = {",
            "    \"DATA/variant1.bin\"",
            "}",
            "entries: map[hash,embed] = {",
            "}"), edit.getText());
    }

    @Test
    void missingSectionLeavesTextAlone() {
        String text = Fixtures.lines("entries: map[hash,embed] = {", "}");

        XrefEdit edit = updater.addResolverRecords(text, Map.of("a", "a"));

        assertFalse(edit.isSectionFound());
        assertFalse(edit.isChanged());
        assertEquals(text, edit.getText());
        assertEquals(List.of("a"), edit.getSkipped());
    }

    @Test
    void removesOnlyTheNamedRecords() {
        Map<String, String> additions = new LinkedHashMap<>();
        additions.put("A", "A");
        additions.put("B", "B");
        String added = updater.addResolverRecords(source, additions).getText();

        XrefEdit edit = updater.removeResolverRecords(added, List.of("B", "Missing"));

        assertEquals(List.of("B"), edit.getApplied());
        assertEquals(List.of("Missing"), edit.getSkipped());
        assertEquals(List.of(ORB, "A"), List.copyOf(updater.read(edit.getText()).getRecords().keySet()));
        assertEquals(source, updater.removeResolverRecords(edit.getText(), List.of("A")).getText());
    }

    @Test
    void removesLinkedFilesIgnoringCase() {
        XrefEdit edit = updater.removeLinkedFiles(source, List.of("data/characters/ahri/ahri.bin"));

        assertEquals(List.of("DATA/Characters/Ahri/Ahri.bin"), edit.getApplied());
        CrossReferenceTable table = updater.read(edit.getText());
        assertTrue(table.isLinkedFound());
        assertTrue(table.getLinkedFiles().isEmpty());
        assertFalse(edit.getText().contains("Ahri.bin"));
    }
}
