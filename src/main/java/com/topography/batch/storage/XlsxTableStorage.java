package com.topography.batch.storage;

import com.topography.batch.exception.TableStorageException;
import com.topography.batch.model.ResultTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

/**
 * XLSX表格读写，直接处理SpreadsheetML压缩包。
 *
 * 写出单工作表的最小工作簿：有限数值写为数值单元格，其余写为内联字符串。
 * 读取第一个工作表，支持共享字符串、内联字符串、数值和布尔单元格。
 */
public class XlsxTableStorage implements TableStorage {

    private static final Logger log = LoggerFactory.getLogger(XlsxTableStorage.class);

    private static final String DEFAULT_SHEET = "xl/worksheets/sheet1.xml";
    private static final String SHEET_NAME = "results";

    @Override
    public ResultTable read(Path path) {
        List<List<Object>> cells;
        try (ZipFile zip = new ZipFile(path.toFile())) {
            List<String> sharedStrings = readSharedStrings(zip);
            String sheetEntry = firstSheetEntry(zip);
            if (zip.getEntry(sheetEntry) == null) {
                throw new TableStorageException(path, "Workbook has no worksheet " + sheetEntry);
            }
            cells = readSheetRows(zip, sheetEntry, sharedStrings);
        } catch (IOException | SAXException | ParserConfigurationException e) {
            throw new TableStorageException(path, "Failed to read XLSX file", e);
        }

        if (cells.isEmpty()) {
            throw new TableStorageException(path, "Worksheet has no header row");
        }
        List<String> header = new ArrayList<>();
        for (Object value : cells.get(0)) {
            header.add(CellValues.format(value));
        }
        TableStorages.checkHeader(path, header);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 1; i < cells.size(); i++) {
            List<Object> values = cells.get(i);
            Map<String, Object> row = new LinkedHashMap<>();
            for (int c = 0; c < header.size(); c++) {
                row.put(header.get(c), c < values.size() ? values.get(c) : null);
            }
            rows.add(row);
        }
        log.debug("Read {} rows from {}", rows.size(), path);
        return new ResultTable(header, rows);
    }

    @Override
    public void write(ResultTable table, Path path) {
        try {
            CsvTableStorage.createParentDirectories(path);
            try (ZipOutputStream zos = new ZipOutputStream(Files.newOutputStream(path))) {
                putEntry(zos, "[Content_Types].xml", contentTypesXml());
                putEntry(zos, "_rels/.rels", relsXml());
                putEntry(zos, "xl/workbook.xml", workbookXml());
                putEntry(zos, "xl/_rels/workbook.xml.rels", workbookRelsXml());
                putEntry(zos, DEFAULT_SHEET, sheetXml(table));
            }
        } catch (IOException e) {
            throw new TableStorageException(path, "Failed to write XLSX file", e);
        }
        log.info("Wrote {} rows to {}", table.size(), path);
    }

    // ---------------------------------------------------------------- 写出

    private static void putEntry(ZipOutputStream zos, String name, String xml) throws IOException {
        zos.putNextEntry(new ZipEntry(name));
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);
        zos.write(bytes, 0, bytes.length);
        zos.closeEntry();
    }

    private static String contentTypesXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
                + "<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
                + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
                + "<Override PartName=\"/xl/workbook.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml\"/>"
                + "<Override PartName=\"/" + DEFAULT_SHEET + "\" ContentType=\"application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml\"/>"
                + "</Types>";
    }

    private static String relsXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
                + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument\" Target=\"xl/workbook.xml\"/>"
                + "</Relationships>";
    }

    private static String workbookXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<workbook xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\" xmlns:r=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships\">"
                + "<sheets><sheet name=\"" + SHEET_NAME + "\" sheetId=\"1\" r:id=\"rId1\"/></sheets>"
                + "</workbook>";
    }

    private static String workbookRelsXml() {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
                + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/worksheet\" Target=\"worksheets/sheet1.xml\"/>"
                + "</Relationships>";
    }

    private static String sheetXml(ResultTable table) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>");
        sb.append("<worksheet xmlns=\"http://schemas.openxmlformats.org/spreadsheetml/2006/main\"><sheetData>");
        List<String> columns = table.getColumns();
        appendRow(sb, 1, new ArrayList<>(columns));
        int r = 2;
        for (Map<String, Object> row : table.getRows()) {
            List<Object> values = new ArrayList<>(columns.size());
            for (String column : columns) {
                values.add(row.get(column));
            }
            appendRow(sb, r++, values);
        }
        sb.append("</sheetData></worksheet>");
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, int rowNumber, List<Object> values) {
        sb.append("<row r=\"").append(rowNumber).append("\">");
        for (int c = 0; c < values.size(); c++) {
            Object value = values.get(c);
            if (value == null) continue;
            String cellRef = colRef(c + 1) + rowNumber;
            if (CellValues.isFiniteNumber(value)) {
                sb.append("<c r=\"").append(cellRef).append("\" t=\"n\"><v>")
                        .append(xmlEscape(String.valueOf(value))).append("</v></c>");
            } else if (value instanceof Boolean) {
                sb.append("<c r=\"").append(cellRef).append("\" t=\"b\"><v>")
                        .append((Boolean) value ? "1" : "0").append("</v></c>");
            } else {
                sb.append("<c r=\"").append(cellRef).append("\" t=\"inlineStr\"><is><t>")
                        .append(xmlEscape(String.valueOf(value))).append("</t></is></c>");
            }
        }
        sb.append("</row>");
    }

    static String colRef(int idx) {
        StringBuilder sb = new StringBuilder();
        while (idx > 0) {
            idx--;
            sb.insert(0, (char) ('A' + (idx % 26)));
            idx /= 26;
        }
        return sb.toString();
    }

    private static String xmlEscape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    // ---------------------------------------------------------------- 读取

    private static DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        dbf.setExpandEntityReferences(false);
        return dbf.newDocumentBuilder();
    }

    private static Document parseEntry(ZipFile zip, ZipEntry entry)
            throws IOException, SAXException, ParserConfigurationException {
        try (InputStream in = zip.getInputStream(entry)) {
            return newDocumentBuilder().parse(in);
        }
    }

    private static List<String> readSharedStrings(ZipFile zip)
            throws IOException, SAXException, ParserConfigurationException {
        List<String> strings = new ArrayList<>();
        ZipEntry entry = zip.getEntry("xl/sharedStrings.xml");
        if (entry == null) return strings;
        NodeList items = parseEntry(zip, entry).getElementsByTagName("si");
        for (int i = 0; i < items.getLength(); i++) {
            // 富文本条目由多个<t>拼接
            NodeList texts = ((Element) items.item(i)).getElementsByTagName("t");
            StringBuilder sb = new StringBuilder();
            for (int j = 0; j < texts.getLength(); j++) {
                sb.append(texts.item(j).getTextContent());
            }
            strings.add(sb.toString());
        }
        return strings;
    }

    /** 由workbook.xml中的第一个sheet经关系文件定位工作表，找不到时使用sheet1.xml */
    private static String firstSheetEntry(ZipFile zip)
            throws IOException, SAXException, ParserConfigurationException {
        ZipEntry workbook = zip.getEntry("xl/workbook.xml");
        ZipEntry rels = zip.getEntry("xl/_rels/workbook.xml.rels");
        if (workbook == null || rels == null) return DEFAULT_SHEET;

        NodeList sheets = parseEntry(zip, workbook).getElementsByTagName("sheet");
        if (sheets.getLength() == 0) return DEFAULT_SHEET;
        String relId = ((Element) sheets.item(0)).getAttribute("r:id");
        if (relId.isEmpty()) return DEFAULT_SHEET;

        NodeList relationships = parseEntry(zip, rels).getElementsByTagName("Relationship");
        for (int i = 0; i < relationships.getLength(); i++) {
            Element rel = (Element) relationships.item(i);
            if (relId.equals(rel.getAttribute("Id"))) {
                String target = rel.getAttribute("Target");
                return target.startsWith("/") ? target.substring(1) : "xl/" + target;
            }
        }
        return DEFAULT_SHEET;
    }

    private static List<List<Object>> readSheetRows(ZipFile zip, String entryName, List<String> sharedStrings)
            throws IOException, SAXException, ParserConfigurationException {
        List<List<Object>> out = new ArrayList<>();
        NodeList rows = parseEntry(zip, zip.getEntry(entryName)).getElementsByTagName("row");
        for (int i = 0; i < rows.getLength(); i++) {
            NodeList cells = ((Element) rows.item(i)).getElementsByTagName("c");
            List<Object> row = new ArrayList<>();
            for (int j = 0; j < cells.getLength(); j++) {
                Element cell = (Element) cells.item(j);
                String ref = cell.getAttribute("r");
                int idx = ref.isEmpty() ? row.size() : columnIndex(ref);
                while (row.size() < idx) {
                    row.add(null);
                }
                row.add(cellValue(cell, sharedStrings));
            }
            out.add(row);
        }
        return out;
    }

    private static Object cellValue(Element cell, List<String> sharedStrings) {
        String type = cell.getAttribute("t");
        if ("inlineStr".equals(type)) {
            NodeList texts = cell.getElementsByTagName("t");
            StringBuilder sb = new StringBuilder();
            for (int k = 0; k < texts.getLength(); k++) {
                sb.append(texts.item(k).getTextContent());
            }
            return sb.toString();
        }
        NodeList vs = cell.getElementsByTagName("v");
        if (vs.getLength() == 0) return null;
        String raw = vs.item(0).getTextContent();
        switch (type) {
            case "s":
                return sharedStrings.get(Integer.parseInt(raw.trim()));
            case "str":
                return raw;
            case "b":
                return "1".equals(raw.trim());
            case "e":
                return null;
            default:
                return CellValues.parse(raw);
        }
    }

    static int columnIndex(String cellRef) {
        int i = 0;
        while (i < cellRef.length() && Character.isLetter(cellRef.charAt(i))) i++;
        String col = cellRef.substring(0, i).toUpperCase(Locale.ROOT);
        int idx = 0;
        for (int k = 0; k < col.length(); k++) {
            idx = idx * 26 + (col.charAt(k) - 'A' + 1);
        }
        return Math.max(0, idx - 1);
    }
}
