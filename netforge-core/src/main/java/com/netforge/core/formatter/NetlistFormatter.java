package com.netforge.core.formatter;

import com.netforge.core.model.Netlist;

/**
 * Interface for formatters that write a {@link Netlist} as text.
 *
 * <p>Formatters are discovered via Java Service Provider Interface (SPI) and
 * selected by id on the command line or in {@code netforge.yaml}.
 *
 * <p>Every formatter lists components sorted by refdes (kind when the refdes is
 * empty), keeps nets in netlist order and lists the pins of a net sorted by
 * refdes then port.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CsvFormatter implements NetlistFormatter {
 *     @Override
 *     public String getId() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "CSV Pin List";
 *     }
 *
 *     @Override
 *     public String getFileExtension() {
 *         return "csv";
 *     }
 *
 *     @Override
 *     public String format(Netlist netlist, FormatterConfig config) {
 *         StringBuilder sb = new StringBuilder("refdes,pin,net\n");
 *         for (Component c : netlist.sortedComponents()) {
 *             for (Pin pin : c.pins()) {
 *                 sb.append(c.refdes()).append(',').append(pin.name()).append(',').append(pin.net()).append('\n');
 *             }
 *         }
 *         return sb.toString();
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.netforge.core.formatter.NetlistFormatter}
 *
 * @see FormatterConfig
 * @see NetlistFormatters
 */
public interface NetlistFormatter {

    /**
     * Returns unique identifier for this formatter.
     *
     * <p>Lowercase, e.g. "spice" or "simple".
     *
     * @return unique formatter identifier
     */
    String getId();

    /**
     * Returns human-readable display name for this formatter.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns file extension for formatted netlists.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Formats a netlist.
     *
     * @param netlist netlist to write
     * @param config formatter settings
     * @return formatted text, lines separated by {@code \n}
     * @throws NullPointerException if an argument is null
     */
    String format(Netlist netlist, FormatterConfig config);
}
