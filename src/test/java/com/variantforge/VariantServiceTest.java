package com.variantforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.variantforge.document.VariantState;
import com.variantforge.models.AuditRecord;
import com.variantforge.models.DocumentChange;
import com.variantforge.models.EntrySummary;
import com.variantforge.models.VariantDefaults;
import com.variantforge.models.VariantRunResult;
import com.variantforge.transform.TransformRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariantServiceTest {

    private static final String DOC = "skins/skin0.py";
    private static final String ORB = "Characters/Ahri/Skins/Skin0/Particles/Ahri_Base_Q_Orb";
    private static final String HASHED = "0x1a2b3c4d";

    @TempDir
    Path root;

    private VariantService service;
    private String source;

    @BeforeEach
    void setUp() throws Exception {
        source = Fixtures.load("skin0.py");
        Files.createDirectories(root.resolve("skins"));
        Files.write(root.resolve(DOC), source.getBytes(StandardCharsets.UTF_8));
        Path orb = root.resolve("ASSETS/Characters/Ahri/Skins/Base/Particles/orb.tex");
        Files.createDirectories(orb.getParent());
        Files.write(orb, new byte[] {1, 2, 3});
        service = new VariantService(new DocumentWorkspace(root),
            new VariantDefaultsStore(root, new ObjectMapper()), new TransformAuditStore(root));
    }

    private static <T extends TransformRequest> T request(T request, String... identifiers) {
        request.setIdentifiers(List.of(identifiers));
        return request;
    }

    private String read(String relative) throws Exception {
        return new String(Files.readAllBytes(root.resolve(relative)), StandardCharsets.UTF_8);
    }

    @Test
    void listsEntriesWithTheirState() throws Exception {
        List<EntrySummary> entries = service.listEntries(DOC);

        assertEquals(3, entries.size());
        EntrySummary orb = entries.get(0);
        assertEquals(ORB, orb.getIdentifier());
        assertEquals("Ahri_Base_Q_Orb", orb.getDisplayName());
        assertEquals(VariantState.NONE, orb.getVariantState());
        assertFalse(orb.isToggleScreen());
        assertEquals(2, orb.getSubEntries().size());
        assertTrue(orb.getSubEntries().get(1).hasExclusionFlag());
        assertTrue(entries.get(1).getSubEntries().get(0).hasDiscriminator());
        assertEquals(2, orb.getAssets().size());
    }

    @Test
    void previewWritesNothing() throws Exception {
        VariantRunResult result = service.preview(DOC, request(new TransformRequest.InlineVariantPair(), ORB));

        assertFalse(result.isApplied());
        assertTrue(result.getOutcome().isSuccess());
        assertEquals(1, result.getChanges().size());
        DocumentChange change = result.getChanges().get(0);
        assertTrue(change.getDiff().startsWith("--- " + DOC));
        assertTrue(change.getDiff().contains("+                emitterName: string = \"Orb_Variant2\""));
        assertEquals(source, read(DOC));
        assertTrue(service.history().isEmpty());
        assertFalse(Files.exists(root.resolve("assets")));
    }

    @Test
    void applyBacksUpWritesCopiesAssetsAndRecordsHistory() throws Exception {
        VariantRunResult result = service.apply(DOC, request(new TransformRequest.InlineVariantPair(), ORB));

        assertTrue(result.isApplied());
        assertEquals(result.getChanges().get(0).getNewText(), read(DOC));
        assertEquals(1, result.getBackups().size());
        assertTrue(result.getBackups().get(0).startsWith(DOC + ".bak_"));
        assertEquals(source, read(result.getBackups().get(0)));

        assertEquals(List.of("assets/variant1/orb.tex", "assets/variant2/orb.tex"), result.getCopiedAssets());
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(root.resolve("assets/variant2/orb.tex")));
        assertFalse(result.getMissingAssets().isEmpty());
        assertTrue(result.getMissingAssets().stream().allMatch(p -> p.endsWith("glow.dds")));

        List<AuditRecord> history = service.history();
        assertEquals(1, history.size());
        assertTrue(history.get(0).isSuccess());
        assertEquals("INLINE_VARIANT_PAIR", history.get(0).getKind());
        assertEquals(List.of(DOC), history.get(0).getWrittenFiles());
        assertEquals(List.of(ORB), history.get(0).getAffectedIdentifiers());
    }

    @Test
    void toggleScreenIsListedAfterInsert() throws Exception {
        VariantRunResult result = service.apply(DOC, new TransformRequest.InsertToggleScreen());

        assertTrue(result.isApplied());
        List<EntrySummary> entries = service.listEntries(DOC);
        assertEquals(4, entries.size());
        assertTrue(entries.get(2).isToggleScreen());
        assertEquals("togglescreen", entries.get(2).getIdentifier());
        assertEquals("INSERT_TOGGLE_SCREEN", service.history().get(0).getKind());
    }

    @Test
    void failedApplyIsRecordedButWritesNothing() throws Exception {
        VariantRunResult result = service.apply(DOC, request(new TransformRequest.InlineVariantPair(), "Nope"));

        assertFalse(result.isApplied());
        assertFalse(result.getOutcome().isSuccess());
        assertTrue(result.getChanges().isEmpty());
        assertEquals(source, read(DOC));
        List<AuditRecord> history = service.history();
        assertEquals(1, history.size());
        assertFalse(history.get(0).isSuccess());
        assertTrue(history.get(0).getWrittenFiles().isEmpty());
    }

    @Test
    void variantDocumentsAreCreatedThenExtended() throws Exception {
        VariantRunResult first = service.apply(DOC, request(new TransformRequest.DetachedVariantDocuments(), ORB));

        assertTrue(first.isApplied());
        assertEquals(3, first.getChanges().size());
        assertTrue(first.getChanges().get(1).isCreated());
        assertEquals("skins/variant1.py", first.getChanges().get(1).getPath());
        assertEquals("skins/variant2.py", first.getChanges().get(2).getPath());
        assertTrue(read("skins/variant2.py").contains("\"" + ORB + "_child_variant2\" = VfxSystemDefinitionData {"));
        assertTrue(read(DOC).contains("\"DATA/variant1.bin\""));

        VariantRunResult second = service.apply(DOC,
            request(new TransformRequest.DetachedVariantDocuments(), HASHED));

        assertTrue(second.isApplied());
        assertFalse(second.getChanges().get(1).isCreated());
        String variant1 = read("skins/variant1.py");
        assertTrue(variant1.contains(ORB + "_child_variant1"));
        assertTrue(variant1.contains(HASHED + "_child_variant1"));
        assertEquals(3, second.getBackups().size());
        assertEquals(2, service.history().size());
    }

    @Test
    void pathsAreCheckedAgainstTheWorkspace() {
        assertThrows(FileNotFoundException.class, () -> service.listEntries("skins/missing.py"));
        assertThrows(SecurityException.class, () -> service.crossReferences("../outside.py"));
        assertThrows(IllegalArgumentException.class, () -> service.preview(" ", new TransformRequest.Reverse()));
        assertThrows(IllegalArgumentException.class, () -> service.apply(DOC, null));
    }

    @Test
    void defaultsAreValidatedBeforeSaving() throws Exception {
        VariantDefaults clash = new VariantDefaults();
        clash.setSuffixA("_Same");
        clash.setSuffixB("_same");
        assertThrows(IllegalArgumentException.class, () -> service.updateDefaults(clash));
        assertThrows(IllegalArgumentException.class, () -> service.updateDefaults(null));

        VariantDefaults night = new VariantDefaults();
        night.setSuffixB("_Night");
        service.updateDefaults(night);

        assertEquals("_Night", service.getDefaults().getSuffixB());
        VariantRunResult result = service.preview(DOC, request(new TransformRequest.InlineVariantPair(), ORB));
        assertTrue(result.getChanges().get(0).getNewText().contains("\"Orb_Night\""));
    }
}
