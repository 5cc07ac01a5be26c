// File: src/main/java/com/example/docxcleaner/TextRunRewriter.java
package com.example.docxcleaner;

import com.example.docxcleaner.CleanerException.ErrorKind;
import com.example.docxcleaner.PartSelector.PartRole;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.XmlOptions;

import javax.xml.namespace.QName;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * 单个部件的 XML 改写：只改 run 下的文本节点（w:r/w:t、w:r/w:delText、m:r/m:t），
 * 其它元素只遍历不修改。属性顺序、命名空间前缀、空白文本由 XmlBeans 的存储原样保留。
 */
public final class TextRunRewriter {
    private TextRunRewriter() {}

    static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String NS_M = "http://schemas.openxmlformats.org/officeDocument/2006/math";

    private static final QName QN_W_R       = new QName(NS_W, "r");
    private static final QName QN_W_T       = new QName(NS_W, "t");
    private static final QName QN_W_DELTEXT = new QName(NS_W, "delText");
    private static final QName QN_M_R       = new QName(NS_M, "r");
    private static final QName QN_M_T       = new QName(NS_M, "t");

    // 限制实体展开，禁止 DOCTYPE（OOXML 部件里不会出现）
    private static final XmlOptions LOAD_OPTIONS = new XmlOptions()
            .setDisallowDocTypeDeclaration(true)
            .setLoadEntityBytesLimit(4096);

    private static final XmlOptions SAVE_OPTIONS = new XmlOptions()
            .setCharacterEncoding("UTF-8");

    public static final class Result {
        public final byte[] xml;
        /** 删除的码点总数 */
        public final int removed;

        Result(byte[] xml, int removed) { this.xml = xml; this.removed = removed; }
    }

    public static Result rewrite(byte[] xml, Set<Integer> denylist) throws CleanerException {
        return rewrite(xml, denylist, null, null, null);
    }

    /**
     * @param role     非 null 时校验根元素与角色一致，不一致抛 UNSUPPORTED_PART
     * @param partName 仅用于异常信息
     * @param counts   按码点累计删除次数，可为 null
     */
    public static Result rewrite(byte[] xml, Set<Integer> denylist, PartRole role, String partName,
                                 Map<Integer, Integer> counts) throws CleanerException {
        XmlObject doc;
        try {
            doc = XmlObject.Factory.parse(new ByteArrayInputStream(xml), LOAD_OPTIONS);
        } catch (XmlException e) {
            throw new CleanerException(ErrorKind.MALFORMED_XML, partName, "part is not well-formed XML", e);
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, partName, "failed to read part", e);
        }

        int[] removed = {0};
        try (XmlCursor cur = doc.newCursor()) {
            if (role != null && role.isTextBearing()) checkRoot(cur, role, partName);
            walk(cur, denylist, counts, removed, partName);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream(xml.length + 64);
        try {
            doc.save(out, SAVE_OPTIONS);
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, partName, "failed to serialize part", e);
        }
        return new Result(out.toByteArray(), removed[0]);
    }

    private static void checkRoot(XmlCursor cur, PartRole role, String partName) throws CleanerException {
        try (XmlCursor c = cur.newCursor()) {
            QName expected = new QName(NS_W, role.rootLocalName);
            if (!c.toFirstChild() || !expected.equals(c.getName())) {
                throw new CleanerException(ErrorKind.UNSUPPORTED_PART, partName,
                        "unexpected root element " + (c.getName() == null ? "<none>" : c.getName())
                                + " for " + role);
            }
        }
    }

    /** 深度优先；游标进入时指向容器，返回时仍指向它 */
    private static void walk(XmlCursor cur, Set<Integer> denylist, Map<Integer, Integer> counts,
                             int[] removed, String partName) throws CleanerException {
        if (!cur.toFirstChild()) return;
        do {
            QName name = cur.getName();
            if (QN_W_R.equals(name)) {
                rewriteRunTexts(cur, QN_W_T, QN_W_DELTEXT, denylist, counts, removed, partName);
            } else if (QN_M_R.equals(name)) {
                rewriteRunTexts(cur, QN_M_T, null, denylist, counts, removed, partName);
            }
            // run 内可能嵌套文本框/图形里的 run，继续下钻
            walk(cur, denylist, counts, removed, partName);
        } while (cur.toNextSibling());
        cur.toParent();
    }

    private static void rewriteRunTexts(XmlCursor run, QName textName, QName delTextName, Set<Integer> denylist,
                                        Map<Integer, Integer> counts, int[] removed, String partName)
            throws CleanerException {
        try (XmlCursor c = run.newCursor()) {
            if (!c.toFirstChild()) return;
            do {
                QName n = c.getName();
                if (!textName.equals(n) && !(delTextName != null && delTextName.equals(n))) continue;

                requireTextOnly(c, partName);
                String text = c.getTextValue();
                String cleaned = CharacterFilter.filter(text, denylist, counts);
                if (cleaned != text) {
                    removed[0] += text.codePointCount(0, text.length()) - cleaned.codePointCount(0, cleaned.length());
                    // 空串也保留元素本身
                    c.setTextValue(cleaned);
                }
            } while (c.toNextSibling());
        }
    }

    /** 文本元素里出现子元素/注释/处理指令时不猜测，整部件降级为原样复制 */
    private static void requireTextOnly(XmlCursor textElement, String partName) throws CleanerException {
        try (XmlCursor c = textElement.newCursor()) {
            XmlCursor.TokenType tt = c.toFirstContentToken();
            while (!tt.isEnd()) {
                if (!tt.isText()) {
                    throw new CleanerException(ErrorKind.UNSUPPORTED_PART, partName,
                            "run text element " + textElement.getName() + " has non-text content (" + tt + ")");
                }
                tt = c.toNextToken();
            }
        }
    }
}
