package nl.bytesoflife.deltaspice.netlist;

/**
 * One entry of a circuit scope: either raw text (terminator included) or a
 * nested subcircuit definition.
 */
public sealed interface NetlistLine permits NetlistLine.Text, NetlistLine.Nested {

    record Text(String text) implements NetlistLine {
        @Override
        public String toString() {
            return text;
        }
    }

    record Nested(SpiceCircuit circuit) implements NetlistLine {
        @Override
        public String toString() {
            return "(subckt " + circuit.describe() + ")";
        }
    }
}
