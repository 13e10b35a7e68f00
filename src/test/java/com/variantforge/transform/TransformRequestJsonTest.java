package com.variantforge.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.variantforge.models.VariantJob;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransformRequestJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void kindSelectsTheRequestType() throws Exception {
        String json = "{\"kind\":\"INLINE_VARIANT_PAIR\",\"identifiers\":[\"Foo\"],"
            + "\"suffixB\":\"_Night\",\"skipExcluded\":true}";

        TransformRequest request = mapper.readValue(json, TransformRequest.class);

        assertTrue(request instanceof TransformRequest.InlineVariantPair);
        TransformRequest.InlineVariantPair inline = (TransformRequest.InlineVariantPair) request;
        assertEquals(List.of("Foo"), inline.getIdentifiers());
        assertEquals("_Night", inline.getSuffixB());
        assertNull(inline.getSuffixA());
        assertTrue(inline.isSkipExcluded());
        assertEquals(TransformRequest.Kind.INLINE_VARIANT_PAIR, inline.getKind());
    }

    @Test
    void propertyRequestsCarryTheirArgument() throws Exception {
        TransformRequest add = mapper.readValue(
            "{\"kind\":\"ADD_PROPERTY\",\"identifiers\":[\"A\"],\"propertyLine\":\"x: u8 = 1\"}",
            TransformRequest.class);
        TransformRequest remove = mapper.readValue(
            "{\"kind\":\"REMOVE_PROPERTY\",\"identifiers\":[\"A\"],\"propertyName\":\"x\"}",
            TransformRequest.class);

        assertEquals("x: u8 = 1", ((TransformRequest.AddProperty) add).getPropertyLine());
        assertEquals("x", ((TransformRequest.RemoveProperty) remove).getPropertyName());
    }

    @Test
    void toggleScreenRequestNeedsNoIdentifiers() throws Exception {
        TransformRequest request = mapper.readValue(
            "{\"kind\":\"INSERT_TOGGLE_SCREEN\",\"referenceId\":\"0x11223344\",\"meshPath\":\"assets/s.scb\"}",
            TransformRequest.class);

        TransformRequest.InsertToggleScreen insert = (TransformRequest.InsertToggleScreen) request;
        assertEquals(TransformRequest.Kind.INSERT_TOGGLE_SCREEN, insert.getKind());
        assertEquals("0x11223344", insert.getReferenceId());
        assertEquals("assets/s.scb", insert.getMeshPath());
        assertNull(insert.getTexturePath());
        assertTrue(insert.getIdentifiers().isEmpty());
        assertFalse(insert.needsIdentifiers());
    }

    @Test
    void serializedRequestKeepsItsKind() throws Exception {
        TransformRequest.Reverse reverse = new TransformRequest.Reverse();
        reverse.setIdentifiers(List.of("Foo"));

        String json = mapper.writeValueAsString(reverse);

        assertTrue(json.contains("\"kind\":\"REVERSE_VARIANT\""));
        TransformRequest back = mapper.readValue(json, TransformRequest.class);
        assertTrue(back instanceof TransformRequest.Reverse);
    }

    @Test
    void unknownKindIsRejected() {
        assertThrows(JsonProcessingException.class,
            () -> mapper.readValue("{\"kind\":\"EXPLODE\",\"identifiers\":[]}", TransformRequest.class));
        assertThrows(JsonProcessingException.class,
            () -> mapper.readValue("{\"identifiers\":[\"Foo\"]}", TransformRequest.class));
    }

    @Test
    void jobWrapsPathAndRequest() throws Exception {
        String json = "{\"path\":\"skins/skin0.py\",\"extra\":1,"
            + "\"request\":{\"kind\":\"DETACHED_VARIANT_DOCUMENTS\",\"identifiers\":[\"Foo\",\"Bar\"]}}";

        VariantJob job = mapper.readValue(json, VariantJob.class);

        assertEquals("skins/skin0.py", job.getPath());
        assertEquals(TransformRequest.Kind.DETACHED_VARIANT_DOCUMENTS, job.getRequest().getKind());
        assertEquals(List.of("Foo", "Bar"), job.getRequest().getIdentifiers());
    }
}
