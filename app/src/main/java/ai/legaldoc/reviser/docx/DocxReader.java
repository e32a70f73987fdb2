package ai.legaldoc.reviser.docx;

import ai.legaldoc.reviser.model.Alignment;
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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.BodyElementType;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTShd;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the body of a Word document into the block model. Only top-level paragraphs and tables are
 * read; other body elements are skipped. The POI document is never modified.
 */
public class DocxReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocxReader.class);
    private static final double TWIPS_PER_POINT = 20.0;

    public Document read(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            Document document = read(input);
            LOGGER.debug("Read {} block(s) from {}", document.size(), path);
            return document;
        } catch (IOException ex) {
            throw new DocxException("Failed to read " + path, ex);
        }
    }

    public Document read(InputStream input) {
        try (XWPFDocument source = new XWPFDocument(input)) {
            return read(source);
        } catch (IOException | POIXMLException | UnsupportedFileFormatException ex) {
            throw new DocxException("Failed to open Word document", ex);
        }
    }

    public Document read(XWPFDocument source) {
        Document document = new Document();
        for (IBodyElement element : source.getBodyElements()) {
            if (element.getElementType() == BodyElementType.PARAGRAPH) {
                Paragraph paragraph = new Paragraph();
                readParagraph((XWPFParagraph) element, paragraph);
                document.add(paragraph);
            } else if (element.getElementType() == BodyElementType.TABLE) {
                document.add(readTable((XWPFTable) element));
            }
        }
        return document;
    }

    private void readParagraph(XWPFParagraph source, Paragraph target) {
        target.setStyleName(source.getStyle());
        CTPPr pPr = source.getCTP().getPPr();
        // the POI indentation and spacing getters create a pPr when absent
        if (pPr != null) {
            if (pPr.isSetJc() && pPr.getJc().getVal() != null) {
                target.setAlignment(Alignment.from(pPr.getJc().getVal().toString()));
            }
            target.setIndentation(new Indentation(
                    points(source.getIndentationLeft()),
                    points(source.getIndentationRight()),
                    points(source.getIndentationFirstLine()),
                    points(source.getIndentationHanging())));
            double line = source.getSpacingBetween();
            target.setSpacing(new Spacing(
                    points(source.getSpacingBefore()),
                    points(source.getSpacingAfter()),
                    line < 0 ? null : line));
            if (pPr.isSetShd()) {
                target.setShading(fill(pPr.getShd()));
            }
        }
        for (XWPFRun run : source.getRuns()) {
            target.addRun(readRun(run));
        }
    }

    private Run readRun(XWPFRun source) {
        Run run = new Run(source.text());
        CTRPr rPr = source.getCTR().getRPr();
        if (rPr != null) {
            if (rPr.sizeOfBArray() > 0) {
                run.setBold(source.isBold());
            }
            if (rPr.sizeOfIArray() > 0) {
                run.setItalic(source.isItalic());
            }
            if (rPr.sizeOfUArray() > 0) {
                run.setUnderline(source.getUnderline() != UnderlinePatterns.NONE);
            }
            if (rPr.sizeOfShdArray() > 0) {
                run.setShading(fill(rPr.getShdArray(0)));
            }
        }
        run.setFontFamily(source.getFontFamily());
        run.setFontSize(source.getFontSizeAsDouble());
        run.setColor(RgbColor.fromHex(source.getColor()).orElse(null));
        return run;
    }

    private Table readTable(XWPFTable source) {
        List<XWPFTableRow> rows = source.getRows();
        int columns = 0;
        for (XWPFTableRow row : rows) {
            columns = Math.max(columns, row.getTableCells().size());
        }
        Table table = new Table(rows.size(), columns);
        XWPFBorderType top = source.getTopBorderType();
        table.setBordered(top != null && top != XWPFBorderType.NONE && top != XWPFBorderType.NIL);
        for (int r = 0; r < rows.size(); r++) {
            List<XWPFTableCell> cells = rows.get(r).getTableCells();
            for (int c = 0; c < cells.size(); c++) {
                XWPFTableCell sourceCell = cells.get(c);
                Cell cell = table.cell(r, c);
                cell.setShading(RgbColor.fromHex(sourceCell.getColor()).orElse(null));
                for (XWPFParagraph paragraph : sourceCell.getParagraphs()) {
                    readParagraph(paragraph, cell.addParagraph());
                }
            }
        }
        return table;
    }

    private static RgbColor fill(CTShd shading) {
        if (!shading.isSetFill()) {
            return null;
        }
        return RgbColor.fromHex(shading.xgetFill().getStringValue()).orElse(null);
    }

    private static Double points(int twips) {
        return twips < 0 ? null : twips / TWIPS_PER_POINT;
    }
}
