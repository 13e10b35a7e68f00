package com.variantforge.transform;

import com.variantforge.Fixtures;
import com.variantforge.document.Document;
import com.variantforge.document.DocumentReader;
import com.variantforge.document.Entry;
import com.variantforge.document.VariantState;
import com.variantforge.xref.CrossReferenceTable;
import com.variantforge.xref.CrossReferenceUpdater;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTransformerTest {

    private static final String ORB = "Characters/Ahri/Skins/Skin0/Particles/Ahri_Base_Q_Orb";
    private static final String HASHED = "0x1a2b3c4d";

    private final DocumentTransformer transformer = new DocumentTransformer();
    private final DocumentReader reader = new DocumentReader();
    private final String source = Fixtures.load("skin0.py");

    private static <T extends TransformRequest> T request(T request, String... identifiers) {
        request.setIdentifiers(List.of(identifiers));
        return request;
    }

    @Test
    void inlinePairTouchesOnlySelectedEntries() {
        TransformOutcome outcome = transformer.apply(source, request(new TransformRequest.InlineVariantPair(), ORB));

        assertTrue(outcome.isSuccess());
        assertEquals(List.of(ORB), outcome.getAffectedIdentifiers());
        assertEquals("Converted 1 entr(ies) to inline variants", outcome.getMessage());
        Document before = reader.read(source);
        Document after = reader.read(outcome.getText());
        assertEquals(before.getHeader(), after.getHeader());
        assertEquals(before.getFooter(), after.getFooter());
        assertEquals(before.find(HASHED).orElseThrow().getText(), after.find(HASHED).orElseThrow().getText());
        assertEquals(before.find(HASHED).orElseThrow().getPrefix(), after.find(HASHED).orElseThrow().getPrefix());
        assertEquals(VariantState.INLINE_PAIR, after.find(ORB).orElseThrow().getVariantState());
        assertEquals(4, outcome.getAssetMappings().size());
    }

    @Test
    void requestOverridesApply() {
        TransformRequest.InlineVariantPair request = request(new TransformRequest.InlineVariantPair(), ORB);
        request.setSuffixA("_Day");
        request.setSuffixB("_Night");
        request.setFolderB("assets/night");
        request.setSkipExcluded(true);

        TransformOutcome outcome = transformer.apply(source, request);

        assertTrue(outcome.getText().contains("\"Orb_Day\""));
        assertTrue(outcome.getText().contains("\"Orb_Night\""));
        assertTrue(outcome.getText().contains("\"assets/night/orb.tex\""));
        assertFalse(outcome.getText().contains("Glow_Day"));
        assertEquals(List.of("Glow"), outcome.getReport().getExcluded());
    }

    @Test
    void missingIdentifierFailsWithoutChanges() {
        TransformOutcome outcome = transformer.apply(source,
            request(new TransformRequest.InlineVariantPair(), ORB, "Nope"));

        assertFalse(outcome.isSuccess());
        assertEquals(source, outcome.getText());
        assertEquals(List.of("Nope"), outcome.getReport().getNotFound());
        assertTrue(outcome.getMessage().contains("Nope"));
    }

    @Test
    void invalidCallsFailImmediately() {
        assertFalse(transformer.apply("", request(new TransformRequest.InlineVariantPair(), ORB)).isSuccess());
        assertFalse(transformer.apply(source, null).isSuccess());
        assertFalse(transformer.apply(source, new TransformRequest.InlineVariantPair()).isSuccess());

        TransformRequest.InlineVariantPair sameSuffix = request(new TransformRequest.InlineVariantPair(), ORB);
        sameSuffix.setSuffixA("_X");
        sameSuffix.setSuffixB("_x");
        TransformOutcome outcome = transformer.apply(source, sameSuffix);
        assertFalse(outcome.isSuccess());
        assertEquals(source, outcome.getText());
    }

    @Test
    void alreadyPairedEntryIsReportedNotChanged() {
        String once = transformer.apply(source, request(new TransformRequest.InlineVariantPair(), ORB)).getText();
        TransformOutcome again = transformer.apply(once, request(new TransformRequest.InlineVariantPair(), ORB));

        assertTrue(again.isSuccess());
        assertEquals(once, again.getText());
        assertTrue(again.getAffectedIdentifiers().isEmpty());
        assertEquals(List.of(ORB), again.getReport().getAlreadyVariant());
        assertTrue(again.getMessage().startsWith("No changes made"));
    }

    @Test
    void inlineThenReverseGivesBackTheDocument() {
        String paired = transformer.apply(source, request(new TransformRequest.InlineVariantPair(), ORB)).getText();
        TransformOutcome reversed = transformer.apply(paired, request(new TransformRequest.Reverse(), ORB));

        assertTrue(reversed.isSuccess());
        assertEquals(source, reversed.getText());
    }

    @Test
    void detachedPairAddsSiblingsAndResolverRecords() {
        TransformOutcome outcome = transformer.apply(source, request(new TransformRequest.DetachedVariantPair(), ORB));

        assertTrue(outcome.isSuccess());
        Document after = reader.read(outcome.getText());
        assertEquals(5, after.getEntries().size());
        assertEquals(VariantState.DISPATCHER, after.find(ORB).orElseThrow().getVariantState());
        assertTrue(after.find(ORB + "_child_variant1").isPresent());
        assertTrue(after.find(ORB + "_child_variant2").isPresent());

        CrossReferenceTable table = new CrossReferenceUpdater().read(outcome.getText());
        assertEquals(3, table.getRecords().size());
        assertEquals(ORB + "_child_variant1", table.getRecords().get(ORB + "_child_variant1"));
        assertEquals(List.of(ORB + "_child_variant1", ORB + "_child_variant2"),
            outcome.getReport().getCrossReferencesAdded());
    }

    @Test
    void detachedIntoSecondaryDocumentsLeavesOnlyTheDispatcher() {
        TransformOutcome outcome = transformer.apply(source,
            request(new TransformRequest.DetachedVariantDocuments(), ORB, HASHED));

        assertTrue(outcome.isSuccess());
        Document after = reader.read(outcome.getText());
        assertEquals(3, after.getEntries().size());
        assertEquals(2, outcome.getSecondaryEntriesA().size());
        assertEquals(2, outcome.getSecondaryEntriesB().size());
        Entry siblingB = reader.readEntry(outcome.getSecondaryEntriesB().get(1)).orElseThrow();
        assertEquals(HASHED + "_child_variant2", siblingB.getIdentifier());

        CrossReferenceTable table = new CrossReferenceUpdater().read(outcome.getText());
        assertTrue(table.isLinked("data/variant1.bin"));
        assertTrue(table.isLinked("DATA/variant2.bin"));
        assertTrue(table.hasRecord(HASHED + "_child_variant2"));
    }

    @Test
    void reversingDispatcherDropsVariantB() {
        String detached = transformer.apply(source, request(new TransformRequest.DetachedVariantPair(), ORB)).getText();

        TransformOutcome outcome = transformer.apply(detached, request(new TransformRequest.Reverse(), ORB));

        assertTrue(outcome.isSuccess());
        Document after = reader.read(outcome.getText());
        assertEquals(4, after.getEntries().size());
        assertTrue(after.find(ORB + "_child_variant2").isEmpty());
        assertTrue(after.find(ORB + "_child_variant1").isPresent());
        Entry dispatcher = after.find(ORB).orElseThrow();
        assertEquals(1, dispatcher.getSubEntries().size());
        CrossReferenceTable table = new CrossReferenceUpdater().read(outcome.getText());
        assertFalse(table.hasRecord(ORB + "_child_variant2"));
        assertTrue(table.hasRecord(ORB + "_child_variant1"));
        assertEquals(List.of(ORB + "_child_variant2"), outcome.getReport().getCrossReferencesRemoved());
    }

    @Test
    void detachingAHalfRemovedDispatcherAgainChangesNothing() {
        String detached = transformer.apply(source, request(new TransformRequest.DetachedVariantPair(), ORB)).getText();
        String reversed = transformer.apply(detached, request(new TransformRequest.Reverse(), ORB)).getText();
        assertEquals(VariantState.DISPATCHER, reader.read(reversed).find(ORB).orElseThrow().getVariantState());

        TransformOutcome again = transformer.apply(reversed, request(new TransformRequest.DetachedVariantPair(), ORB));

        assertTrue(again.isSuccess());
        assertEquals(reversed, again.getText());
        assertEquals(List.of(ORB), again.getReport().getAlreadyVariant());
        Document after = reader.read(again.getText());
        assertEquals(after.getEntries().size(),
            after.getEntries().stream().map(Entry::getIdentifier).distinct().count());
    }

    @Test
    void existingSiblingKeyBlocksDetaching() {
        String withSibling = source.replace(
            "    \"Characters/Ahri/Skins/Skin0/Resources\" = ResourceResolver {",
            Fixtures.lines(
                "    \"" + ORB + "_child_variant2\" = VfxSystemDefinitionData {",
                "        particleName: string = \"Leftover\"",
                "    }",
                "    \"Characters/Ahri/Skins/Skin0/Resources\" = ResourceResolver {"));
        assertEquals(VariantState.NONE, reader.read(withSibling).find(ORB).orElseThrow().getVariantState());

        TransformOutcome pair = transformer.apply(withSibling,
            request(new TransformRequest.DetachedVariantPair(), ORB));
        TransformOutcome documents = transformer.apply(withSibling,
            request(new TransformRequest.DetachedVariantDocuments(), ORB));

        assertEquals(withSibling, pair.getText());
        assertEquals(List.of(ORB), pair.getReport().getAlreadyVariant());
        assertTrue(pair.getAffectedIdentifiers().isEmpty());
        assertEquals(withSibling, documents.getText());
        assertTrue(documents.getSecondaryEntriesB().isEmpty());
    }

    @Test
    void toggleScreenGoesBeforeTheResolver() {
        TransformOutcome outcome = transformer.apply(source, new TransformRequest.InsertToggleScreen());

        assertTrue(outcome.isSuccess(), outcome.getMessage());
        assertEquals(List.of(ToggleScreen.KEY), outcome.getAffectedIdentifiers());
        Document after = reader.read(outcome.getText());
        assertEquals(4, after.getEntries().size());
        Entry screen = after.getEntries().get(2);
        assertEquals(ToggleScreen.KEY, screen.getIdentifier());
        assertTrue(ToggleScreen.isToggleScreen(screen));
        assertEquals(1, screen.getSubEntries().size());
        assertEquals("ResourceResolver", after.getEntries().get(3).getTypeTag());
        assertTrue(screen.getText().contains("StencilReferenceId: hash = 0xe6deedc4"));
        assertTrue(screen.getText().contains("stencilMode: u8 = 1"));
        assertTrue(screen.getText().contains("\"" + ToggleScreen.DEFAULT_MESH + "\""));
        CrossReferenceTable table = new CrossReferenceUpdater().read(outcome.getText());
        assertEquals(2, table.getRecords().size());
        assertEquals(ToggleScreen.KEY, table.getRecords().get(ToggleScreen.KEY));
        assertEquals(List.of(ToggleScreen.KEY), outcome.getReport().getCrossReferencesAdded());
        Document before = reader.read(source);
        assertEquals(before.find(ORB).orElseThrow().getText(), after.find(ORB).orElseThrow().getText());
        assertEquals(before.getHeader(), after.getHeader());

        TransformOutcome second = transformer.apply(outcome.getText(), new TransformRequest.InsertToggleScreen());
        assertFalse(second.isSuccess());
        assertEquals(outcome.getText(), second.getText());
    }

    @Test
    void variantsShareTheToggleScreenReference() {
        TransformRequest.InsertToggleScreen insert = new TransformRequest.InsertToggleScreen();
        insert.setReferenceId("0x11223344");
        String withScreen = transformer.apply(source, insert).getText();

        TransformOutcome paired = transformer.apply(withScreen, request(new TransformRequest.InlineVariantPair(), ORB));

        String orb = reader.read(paired.getText()).find(ORB).orElseThrow().getText();
        assertTrue(orb.contains("StencilReferenceId: hash = 0x11223344"));
        assertFalse(orb.contains("0xe6deedc4"));
        TransformOutcome reversed = transformer.apply(paired.getText(), request(new TransformRequest.Reverse(), ORB));
        assertEquals(withScreen, reversed.getText());
    }

    @Test
    void toggleScreenIsNeverMadeIntoAVariant() {
        String withScreen = transformer.apply(source, new TransformRequest.InsertToggleScreen()).getText();

        TransformOutcome inline = transformer.apply(withScreen,
            request(new TransformRequest.InlineVariantPair(), ToggleScreen.KEY));
        TransformOutcome detached = transformer.apply(withScreen,
            request(new TransformRequest.DetachedVariantPair(), ToggleScreen.KEY));

        assertEquals(withScreen, inline.getText());
        assertEquals(withScreen, detached.getText());
        assertTrue(inline.getAffectedIdentifiers().isEmpty());
        assertEquals(1, inline.getReport().getNotes().size());
    }

    @Test
    void hashedToggleScreenIsRecognisedByItsName() {
        String hashed = Fixtures.lines(
            "0x99 = VfxSystemDefinitionData {",
            "    particleName: string = \"togglescreen\"",
            "}");
        assertTrue(ToggleScreen.isToggleScreen(reader.readEntry(hashed).orElseThrow()));
        assertFalse(ToggleScreen.isToggleScreen(reader.read(source).find(ORB).orElseThrow()));
    }

    @Test
    void addAndRemoveProperty() {
        TransformRequest.AddProperty add = request(new TransformRequest.AddProperty(), ORB, HASHED);
        add.setPropertyLine("disableBackfaceCull: bool = true");
        TransformOutcome added = transformer.apply(source, add);
        assertTrue(added.isSuccess());
        assertEquals(3, added.getReport().getPropertiesInjected());

        TransformRequest.RemoveProperty remove = request(new TransformRequest.RemoveProperty(), ORB, HASHED);
        remove.setPropertyName("disableBackfaceCull");
        TransformOutcome removed = transformer.apply(added.getText(), remove);
        assertEquals(3, removed.getReport().getPropertiesRemoved());
        assertEquals(source, removed.getText());
    }

    @Test
    void blankPropertyArgumentsFail() {
        assertFalse(transformer.apply(source, request(new TransformRequest.AddProperty(), ORB)).isSuccess());
        TransformRequest.RemoveProperty remove = request(new TransformRequest.RemoveProperty(), ORB);
        remove.setPropertyName("  ");
        assertFalse(transformer.apply(source, remove).isSuccess());
    }
}
