package com.example.docxcleaner;

import static com.example.docxcleaner.DocxFixtures.NS_W;
import static com.example.docxcleaner.DocxFixtures.runTexts;
import static com.example.docxcleaner.DocxFixtures.texts;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.docxcleaner.CleanerException.ErrorKind;
import com.example.docxcleaner.PartSelector.PartRole;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TextRunRewriterTest {

    private static final Set<Integer> ZWSP = Set.of(0x200B);

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String body(String inner) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n"
                + "<w:document xmlns:w=\"" + NS_W + "\""
                + " xmlns:m=\"" + TextRunRewriter.NS_M + "\""
                + " xmlns:v=\"urn:schemas-microsoft-com:vml\""
                + " xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\">"
                + "<w:body>" + inner + "</w:body></w:document>";
    }

    @Test
    void stripsDenylistedCharacterFromRunText() throws Exception {
        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(DocxFixtures.document("Hello\u200BWorld")), ZWSP);

        assertEquals(List.of("HelloWorld"), runTexts(r.xml));
        assertEquals(1, r.removed);
    }

    @Test
    void keepsEmptiedTextNode() throws Exception {
        TextRunRewriter.Result r = TextRunRewriter.rewrite(
                utf8(DocxFixtures.document("\u200B\u200B", "kept")), ZWSP);

        assertEquals(List.of("", "kept"), runTexts(r.xml));
        assertEquals(2, r.removed);
    }

    @Test
    void preservesNamespacesAttributeOrderAndSpacePreserve() throws Exception {
        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(DocxFixtures.document("a\u200Bb")), ZWSP);
        String out = new String(r.xml, StandardCharsets.UTF_8);

        assertTrue(out.contains("xmlns:w14=\"http://schemas.microsoft.com/office/word/2010/wordml\""), out);
        assertTrue(out.contains("mc:Ignorable=\"w14\""), out);
        assertTrue(out.contains("w:rsidR=\"00A1\" w:rsidRDefault=\"00B2\""), out);
        assertTrue(out.contains("xml:space=\"preserve\""), out);
        assertTrue(out.contains("<w:b/>"), out);
    }

    @Test
    void reachesRunsNestedInHyperlinksContentControlsAndTextBoxes() throws Exception {
        String xml = body(
                "<w:p><w:hyperlink r:id=\"rId5\"><w:r><w:t>link\u200B</w:t></w:r></w:hyperlink></w:p>"
                + "<w:sdt><w:sdtPr><w:alias w:val=\"Title\"/></w:sdtPr><w:sdtContent>"
                + "<w:p><w:r><w:t>\u200Bsdt</w:t></w:r></w:p></w:sdtContent></w:sdt>"
                + "<w:p><w:r><w:pict><v:shape><v:textbox><w:txbxContent>"
                + "<w:p><w:r><w:t>box\u200Btext</w:t></w:r></w:p>"
                + "</w:txbxContent></v:textbox></v:shape></w:pict></w:r></w:p>");

        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(xml), ZWSP);

        assertEquals(List.of("link", "sdt", "boxtext"), runTexts(r.xml));
        assertEquals(3, r.removed);
    }

    @Test
    void cleansDeletedAndMathRunText() throws Exception {
        String xml = body(
                "<w:p><w:del w:id=\"1\" w:author=\"x\"><w:r><w:delText>gone\u200B</w:delText></w:r></w:del>"
                + "<m:oMath><m:r><m:t>x\u200B+1</m:t></m:r></m:oMath></w:p>");

        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(xml), ZWSP);

        assertEquals(List.of("gone"), texts(r.xml, "delText"));
        String out = new String(r.xml, StandardCharsets.UTF_8);
        assertTrue(out.contains(">x+1<"), out);
    }

    @Test
    void leavesNonRunTextAndAttributesAlone() throws Exception {
        String xml = body(
                "<w:p><w:pPr><w:pStyle w:val=\"Sty\u200Ble\"/></w:pPr>"
                + "<w:r><w:instrText xml:space=\"preserve\"> HYPERLINK \"a\u200Bb\" </w:instrText></w:r>"
                + "<w:r><w:t>t\u200B</w:t></w:r></w:p>");

        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(xml), ZWSP);

        String out = new String(r.xml, StandardCharsets.UTF_8);
        assertTrue(out.contains("w:val=\"Sty\u200Ble\""), out);
        assertEquals(List.of(" HYPERLINK \"a\u200Bb\" "), texts(r.xml, "instrText"));
        assertEquals(List.of("t"), runTexts(r.xml));
    }

    @Test
    void escapesReservedCharactersOnSave() throws Exception {
        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(DocxFixtures.document("a &amp;\u200B &lt;b&gt;")), ZWSP);
        assertEquals(List.of("a & <b>"), runTexts(r.xml));
    }

    @Test
    void secondRewriteEqualsFirst() throws Exception {
        byte[] src = utf8(DocxFixtures.document("one\u200B", "two", "\u200B"));

        byte[] first = TextRunRewriter.rewrite(src, ZWSP).xml;
        byte[] second = TextRunRewriter.rewrite(first, ZWSP).xml;
        assertArrayEquals(first, second);

        byte[] identity = TextRunRewriter.rewrite(utf8(DocxFixtures.document("clean")), Set.of()).xml;
        assertArrayEquals(identity, TextRunRewriter.rewrite(identity, Set.of()).xml);
    }

    @Test
    void accumulatesCountsPerCodePoint() throws Exception {
        Map<Integer, Integer> counts = new HashMap<>();
        TextRunRewriter.rewrite(utf8(DocxFixtures.document("a\u200B\u00AD", "\u200B")),
                Set.of(0x200B, 0x00AD), PartRole.MAIN_DOCUMENT, "word/document.xml", counts);
        assertEquals(Map.of(0x200B, 2, 0x00AD, 1), counts);
    }

    @Test
    void malformedXmlFails() {
        CleanerException e = assertThrows(CleanerException.class,
                () -> TextRunRewriter.rewrite(utf8("<w:document xmlns:w=\"" + NS_W + "\"><w:body>"), ZWSP,
                        PartRole.MAIN_DOCUMENT, "word/document.xml", null));
        assertEquals(ErrorKind.MALFORMED_XML, e.getKind());
        assertEquals("word/document.xml", e.getEntryName());
    }

    @Test
    void nonXmlBytesFail() {
        CleanerException e = assertThrows(CleanerException.class,
                () -> TextRunRewriter.rewrite(new byte[] {0x50, 0x4B, 0x03, 0x04, 0x00}, ZWSP));
        assertEquals(ErrorKind.MALFORMED_XML, e.getKind());
    }

    @Test
    void doctypeIsRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE w:document [<!ENTITY x \"y\">]>"
                + "<w:document xmlns:w=\"" + NS_W + "\"><w:body/></w:document>";
        CleanerException e = assertThrows(CleanerException.class, () -> TextRunRewriter.rewrite(utf8(xml), ZWSP));
        assertEquals(ErrorKind.MALFORMED_XML, e.getKind());
    }

    @Test
    void mixedContentInRunTextIsUnsupported() {
        String xml = body("<w:p><w:r><w:t>a<w:tab/>b\u200B</w:t></w:r></w:p>");
        CleanerException e = assertThrows(CleanerException.class, () -> TextRunRewriter.rewrite(utf8(xml), ZWSP));
        assertEquals(ErrorKind.UNSUPPORTED_PART, e.getKind());
    }

    @Test
    void commentInsideRunTextIsUnsupported() {
        String xml = body("<w:p><w:r><w:t>a<!-- note -->b</w:t></w:r></w:p>");
        CleanerException e = assertThrows(CleanerException.class, () -> TextRunRewriter.rewrite(utf8(xml), ZWSP));
        assertEquals(ErrorKind.UNSUPPORTED_PART, e.getKind());
    }

    @Test
    void rootNotMatchingRoleIsUnsupported() {
        CleanerException e = assertThrows(CleanerException.class,
                () -> TextRunRewriter.rewrite(utf8(DocxFixtures.part("hdr", "x")), ZWSP,
                        PartRole.FOOTER, "word/footer1.xml", null));
        assertEquals(ErrorKind.UNSUPPORTED_PART, e.getKind());
        assertEquals("word/footer1.xml", e.getEntryName());
    }

    @Test
    void rootMatchingRoleIsAccepted() throws Exception {
        TextRunRewriter.Result r = TextRunRewriter.rewrite(utf8(DocxFixtures.part("ftr", "foot\u200B")), ZWSP,
                PartRole.FOOTER, "word/footer1.xml", null);
        assertEquals(List.of("foot"), runTexts(r.xml));
    }
}
