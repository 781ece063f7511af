package com.example.storyextractor.infrastructure.docx;

import com.example.storyextractor.domain.model.DocumentBlock;
import com.example.storyextractor.domain.model.ParagraphBlock;
import com.example.storyextractor.domain.model.TableBlock;
import com.example.storyextractor.domain.model.TableRow;
import com.example.storyextractor.infrastructure.exception.DocumentProcessingException;
import org.apache.poi.EmptyFileException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTVMerge;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that turns an Apache POI {@link XWPFDocument} into the ordered block list consumed by
 * the extraction core. Hides the POI body model from the rest of the application.
 */
@Service
public class PoiDocxBlockReader {

    private static final Logger log = LoggerFactory.getLogger(PoiDocxBlockReader.class);

    /**
     * Reads the top-level paragraphs and tables of a .docx payload in body order.
     *
     * @param docxBytes raw .docx bytes
     * @return ordered blocks, empty for an empty document
     * @throws DocumentProcessingException when the bytes cannot be read as an OOXML word document
     */
    public List<DocumentBlock> readBlocks(byte[] docxBytes) {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(docxBytes))) {
            List<DocumentBlock> blocks = new ArrayList<>();
            for (IBodyElement element : document.getBodyElements()) {
                if (element instanceof XWPFParagraph paragraph) {
                    blocks.add(new ParagraphBlock(paragraph.getText()));
                } else if (element instanceof XWPFTable table) {
                    blocks.add(toTableBlock(table));
                }
            }
            log.debug("Read {} body blocks from document", blocks.size());
            return blocks;
        } catch (EmptyFileException | UnsupportedFileFormatException | POIXMLException ex) {
            throw new DocumentProcessingException("The file is not a readable .docx document.", ex);
        } catch (IOException ex) {
            throw new DocumentProcessingException("Unable to read the .docx package.", ex);
        }
    }

    /**
     * Copies every row and cell text of a POI table laid out on the table grid.
     * A cell spanning several grid columns is repeated once per column, and a vertically merged continuation
     * cell takes the text of the cell above it, so header and data indices stay aligned.
     *
     * @param table POI table
     * @return immutable table block
     */
    private TableBlock toTableBlock(XWPFTable table) {
        List<TableRow> rows = new ArrayList<>();
        List<String> previous = List.of();
        for (XWPFTableRow row : table.getRows()) {
            List<String> cells = new ArrayList<>();
            for (XWPFTableCell cell : row.getTableCells()) {
                int gridColumn = cells.size();
                String text = isMergeContinuation(cell) && gridColumn < previous.size()
                        ? previous.get(gridColumn)
                        : cell.getText();
                for (int i = 0, span = gridSpan(cell); i < span; i++) {
                    cells.add(text);
                }
            }
            rows.add(new TableRow(cells));
            previous = cells;
        }
        return new TableBlock(rows);
    }

    private static int gridSpan(XWPFTableCell cell) {
        CTTcPr pr = cell.getCTTc().getTcPr();
        if (pr != null && pr.isSetGridSpan()) {
            BigInteger span = pr.getGridSpan().getVal();
            return span == null ? 1 : Math.max(1, span.intValue());
        }
        return 1;
    }

    /**
     * {@code <w:vMerge/>} without a value continues the merge started above; {@code w:val="restart"} starts one.
     */
    private static boolean isMergeContinuation(XWPFTableCell cell) {
        CTTcPr pr = cell.getCTTc().getTcPr();
        if (pr == null || !pr.isSetVMerge()) {
            return false;
        }
        CTVMerge merge = pr.getVMerge();
        return !merge.isSetVal() || !STMerge.RESTART.equals(merge.getVal());
    }
}
