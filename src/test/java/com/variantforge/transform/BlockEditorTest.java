package com.variantforge.transform;

import com.variantforge.Fixtures;
import com.variantforge.document.FormatProfile;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BlockEditorTest {

    private final FormatProfile profile = FormatProfile.defaults();

    @Test
    void nestedOneLineBlocksAreSplitDownToTheSubEntry() {
        String entry = "    \"Foo\" = SystemX { list: list[pointer] = { VfxEmitterDefinitionData { "
            + "emitterName: string = \"Bolt\" } } }";

        String expanded = BlockEditor.expandNestedBlocks(entry, profile);

        assertEquals(Fixtures.lines(
            "    \"Foo\" = SystemX {",
            "        list: list[pointer] = {",
            "            VfxEmitterDefinitionData {",
            "                emitterName: string = \"Bolt\"",
            "            }",
            "        }",
            "    }"), expanded);
    }

    @Test
    void siblingsOnOneLineGetTheirOwnBlocks() {
        String entry = "\"Foo\" = SystemX { A_Emitter { n: u8 = 1 } B_Emitter { n: u8 = 2 } }";

        String expanded = BlockEditor.expandNestedBlocks(entry, profile);

        assertEquals(Fixtures.lines(
            "\"Foo\" = SystemX {",
            "    A_Emitter {",
            "        n: u8 = 1",
            "    }",
            "    B_Emitter {",
            "        n: u8 = 2",
            "    }",
            "}"), expanded);
    }

    @Test
    void valueBlocksWithoutSubEntriesStayOnOneLine() {
        String entry = Fixtures.lines(
            "\"Foo\" = SystemX {",
            "    VfxEmitterDefinitionData {",
            "        birthRotation0: embed = ValueVector3 { constantValue: vec3 = { 0, -270, 0 } }",
            "        texture: string = \"a { b }.dds\"",
            "    }",
            "}");

        assertSame(entry, BlockEditor.expandNestedBlocks(entry, profile));
    }
}
