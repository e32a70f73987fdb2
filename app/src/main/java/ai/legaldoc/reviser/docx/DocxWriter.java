package ai.legaldoc.reviser.docx;

import ai.legaldoc.reviser.model.Block;
import ai.legaldoc.reviser.model.Cell;
import ai.legaldoc.reviser.model.Document;
import ai.legaldoc.reviser.model.Indentation;
import ai.legaldoc.reviser.model.Paragraph;
import ai.legaldoc.reviser.model.RgbColor;
import ai.legaldoc.reviser.model.Run;
import ai.legaldoc.reviser.model.Spacing;
import ai.legaldoc.reviser.model.Table;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.xmlbeans.XmlException;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTShd;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STShd;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes the block model into a new Word document.
 *
 * <p>When constructed with a style template, the template's style definitions are copied into every
 * written document so that style ids carried over from the source resolve.</p>
 */
public class DocxWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxWriter.class);
    private static final int TWIPS_PER_POINT = 20;
    private static final int BORDER_SIZE = 4;
    private static final String AUTO = "auto";

    private final Path styleTemplate;

    public DocxWriter() {
        this(null);
    }

    public DocxWriter(Path styleTemplate) {
        this.styleTemplate = styleTemplate;
    }

    public void write(Document document, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream output = Files.newOutputStream(path)) {
                write(document, output);
            }
            LOGGER.info("Wrote {} block(s) to {}", document.size(), path);
        } catch (IOException ex) {
            throw new DocxException("Failed to write " + path, ex);
        }
    }

    public void write(Document document, OutputStream output) {
        try (XWPFDocument target = toXwpf(document)) {
            target.write(output);
        } catch (IOException ex) {
            throw new DocxException("Failed to encode Word document", ex);
        }
    }

    public XWPFDocument toXwpf(Document document) {
        XWPFDocument target = new XWPFDocument();
        if (styleTemplate != null) {
            copyStyles(target);
        }
        for (Block block : document.blocks()) {
            switch (block.kind()) {
                case PARAGRAPH -> writeParagraph(block.asParagraph(), target.createParagraph());
                case TABLE -> writeTable(block.asTable(), target);
            }
        }
        return target;
    }

    private void copyStyles(XWPFDocument target) {
        try (InputStream input = Files.newInputStream(styleTemplate);
             XWPFDocument template = new XWPFDocument(input)) {
            if (template.getStyles() == null) {
                LOGGER.debug("Style template {} has no style definitions", styleTemplate);
                return;
            }
            target.createStyles().setStyles(template.getStyle());
        } catch (IOException | XmlException | POIXMLException | UnsupportedFileFormatException ex) {
            throw new DocxException("Failed to load style template " + styleTemplate, ex);
        }
    }

    private void writeParagraph(Paragraph source, XWPFParagraph target) {
        if (source.styleName() != null) {
            target.setStyle(source.styleName());
        }
        switch (source.alignment()) {
            case LEFT -> target.setAlignment(ParagraphAlignment.LEFT);
            case CENTER -> target.setAlignment(ParagraphAlignment.CENTER);
            case RIGHT -> target.setAlignment(ParagraphAlignment.RIGHT);
            case JUSTIFY -> target.setAlignment(ParagraphAlignment.BOTH);
            case UNSET -> {
            }
        }
        Indentation indentation = source.indentation();
        if (indentation.left() != null) {
            target.setIndentationLeft(twips(indentation.left()));
        }
        if (indentation.right() != null) {
            target.setIndentationRight(twips(indentation.right()));
        }
        if (indentation.firstLine() != null) {
            target.setIndentationFirstLine(twips(indentation.firstLine()));
        }
        if (indentation.hanging() != null) {
            target.setIndentationHanging(twips(indentation.hanging()));
        }
        Spacing spacing = source.spacing();
        if (spacing.before() != null) {
            target.setSpacingBefore(twips(spacing.before()));
        }
        if (spacing.after() != null) {
            target.setSpacingAfter(twips(spacing.after()));
        }
        if (spacing.line() != null) {
            target.setSpacingBetween(spacing.line());
        }
        if (source.shading() != null) {
            CTPPr pPr = target.getCTP().isSetPPr() ? target.getCTP().getPPr() : target.getCTP().addNewPPr();
            applyFill(pPr.isSetShd() ? pPr.getShd() : pPr.addNewShd(), source.shading());
        }
        for (Run run : source.runs()) {
            writeRun(run, target.createRun());
        }
    }

    private void writeRun(Run source, XWPFRun target) {
        target.setText(source.text());
        if (source.bold() != null) {
            target.setBold(source.bold());
        }
        if (source.italic() != null) {
            target.setItalic(source.italic());
        }
        if (source.underline() != null) {
            target.setUnderline(source.underline() ? UnderlinePatterns.SINGLE : UnderlinePatterns.NONE);
        }
        if (source.fontFamily() != null) {
            target.setFontFamily(source.fontFamily());
        }
        if (source.fontSize() != null) {
            target.setFontSize(source.fontSize());
        }
        if (source.color() != null) {
            target.setColor(source.color().toHex());
        }
        if (source.shading() != null) {
            CTRPr rPr = target.getCTR().isSetRPr() ? target.getCTR().getRPr() : target.getCTR().addNewRPr();
            applyFill(rPr.sizeOfShdArray() > 0 ? rPr.getShdArray(0) : rPr.addNewShd(), source.shading());
        }
    }

    private void writeTable(Table source, XWPFDocument target) {
        if (source.rowCount() == 0 || source.columnCount() == 0) {
            LOGGER.debug("Skipping empty table");
            return;
        }
        XWPFTable table = target.createTable(source.rowCount(), source.columnCount());
        XWPFBorderType border = source.bordered() ? XWPFBorderType.SINGLE : XWPFBorderType.NONE;
        int size = source.bordered() ? BORDER_SIZE : 0;
        table.setTopBorder(border, size, 0, AUTO);
        table.setBottomBorder(border, size, 0, AUTO);
        table.setLeftBorder(border, size, 0, AUTO);
        table.setRightBorder(border, size, 0, AUTO);
        table.setInsideHBorder(border, size, 0, AUTO);
        table.setInsideVBorder(border, size, 0, AUTO);
        for (int r = 0; r < source.rowCount(); r++) {
            for (int c = 0; c < source.columnCount(); c++) {
                Cell sourceCell = source.cell(r, c);
                XWPFTableCell targetCell = table.getRow(r).getCell(c);
                if (sourceCell.shading() != null) {
                    targetCell.setColor(sourceCell.shading().toHex());
                }
                List<Paragraph> paragraphs = sourceCell.paragraphs();
                for (int i = 0; i < paragraphs.size(); i++) {
                    XWPFParagraph paragraph = i == 0 && !targetCell.getParagraphs().isEmpty()
                            ? targetCell.getParagraphs().get(0)
                            : targetCell.addParagraph();
                    writeParagraph(paragraphs.get(i), paragraph);
                }
            }
        }
    }

    private static void applyFill(CTShd shading, RgbColor fill) {
        shading.setVal(STShd.CLEAR);
        shading.setColor(AUTO);
        shading.setFill(fill.toHex());
    }

    private static int twips(double points) {
        return (int) Math.round(points * TWIPS_PER_POINT);
    }
}
