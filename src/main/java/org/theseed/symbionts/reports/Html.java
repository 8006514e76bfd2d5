/**
 *
 */
package org.theseed.symbionts.reports;

import static j2html.TagCreator.*;

import java.util.Collection;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import j2html.tags.ContainerTag;
import j2html.tags.DomContent;

/**
 * These are static methods to help when building the prediction web page.
 *
 */
public class Html {

    // STYLE CONSTANTS

    /** background color for values indicating unlikely functions */
    public static final String WEAK_STYLE = "background-color: gold;";

    public static final String TABLE_CLASS = "basic";

    public static final String EXTRA_STYLES = "	body {\n" +
            "		font-family: sans-serif;\n" +
            "	}\n" +
            "	table." + TABLE_CLASS + " {\n" +
            "		border-collapse: collapse;\n" +
            "	}\n" +
            "	table." + TABLE_CLASS + " th, table." + TABLE_CLASS + " td {\n" +
            "		border: 1px solid #a0a0a0;\n" +
            "		padding: 3px 6px;\n" +
            "	}\n" +
            "	table." + TABLE_CLASS + " th {\n" +
            "		background-color: #c8c8c8;\n" +
            "	}\n" +
            "	table." + TABLE_CLASS + " th.num, table." + TABLE_CLASS + " td.num {\n" +
            "		text-align: right;\n" +
            "	}\n" +
            "	table." + TABLE_CLASS + " tr:nth-child(even) {\n" +
            "		background-color: #f0f0f0;\n" +
            "	}\n" +
            "   h1, h2 {\n" +
            "		font-weight: bolder;\n" +
            "	}\n" +
            "   h1, h2, p, ul {\n" +
            "		margin: 12px 12px 0px 12px;\n" +
            "	}\n" +
            "   div.wrapper {\n" +
            "       margin: 12px;\n" +
            "   }\n";

    /**
     * Display an empty table cell.
     */
    public static ContainerTag emptyCell() {
        return td(rawHtml("&nbsp;"));
    }

    /**
     * Display a string in a table cell.  An empty string is shown as a blank cell.
     *
     * @param str	string to display
     */
    public static ContainerTag textCell(String str) {
        ContainerTag retVal;
        if (StringUtils.isBlank(str))
            retVal = emptyCell();
        else
            retVal = td(str);
        return retVal;
    }

    /**
     * Display the specified floating-point value in a table cell.
     *
     * @param val		floating-point value to display
     * @param places	number of decimal places to show
     */
    public static ContainerTag numCell(double val, int places) {
        return td(num(val, places)).withClass("num");
    }

    /**
     * Display the specified integer value in a table cell.
     *
     * @param val	integer value to display
     */
    public static ContainerTag numCell(int val) {
        return td(Integer.toString(val)).withClass("num");
    }

    /**
     * Display the specified floating-point value in an alternate color if the flag is FALSE.
     *
     * @param flag		TRUE if the value is strong, else FALSE
     * @param val		floating-point value to display
     * @param places	number of decimal places to show
     */
    public static ContainerTag colorCell(boolean flag, double val, int places) {
        ContainerTag retVal = numCell(val, places);
        if (! flag)
            retVal = retVal.withStyle(WEAK_STYLE);
        return retVal;
    }

    /**
     * Create a web page with the specified title and body components.
     *
     * @param pTitle	title for the page
     * @param bodyItems	one or more items for the body of the page
     *
     * @return the HTML string for the web page
     */
    public static String page(String pTitle, DomContent... bodyItems) {
        String retVal = html(
                head(
                        meta().attr("charset", "UTF-8"),
                        title(pTitle),
                        style(EXTRA_STYLES).withType("text/css")
                    ),
                    body(bodyItems)
                ).render();
        return retVal;
    }

    /**
     * Add a row to the run statistics table row collection.
     *
     * @param detailRows	statistics table row collection
     * @param label			label for the row
     * @param cell			table cell with the data
     */
    public static void detailRow(List<DomContent> detailRows, String label, ContainerTag cell) {
        detailRows.add(tr(th(label), cell));
    }

    /**
     * @return a formatted floating-point number
     *
     * @param val		floating-point number to format
     * @param places	number of decimal places to show
     */
    public static String num(double val, int places) {
        return String.format("%." + places + "f", val);
    }

    /**
     * @return a table created from the specified rows, with a heading
     *
     * @param header		heading for the table
     * @param collection	rows to put in the table
     */
    public static DomContent formatTable(String header, Collection<DomContent> collection) {
        return join(
                h2(header),
                div(table().with(collection.stream()).withClass(TABLE_CLASS)).withClass("wrapper")
            );
    }

}
