package fr.uga.smtplan.encoding;

/**
 * Short indexed names such as {@code p3_2} for proposition 3 in state 2.
 */
public class TerseNaming implements VariableNaming {

    @Override
    public String time(int happening) {
        return "t" + happening;
    }

    @Override
    public String proposition(int proposition, int state) {
        return "p" + proposition + "_" + state;
    }

    @Override
    public String fluent(int fluent, int state) {
        return "f" + fluent + "_" + state;
    }

    @Override
    public String start(int action, int happening) {
        return "sta" + action + "_" + happening;
    }

    @Override
    public String end(int action, int happening) {
        return "end" + action + "_" + happening;
    }

    @Override
    public String running(int action, int happening) {
        return "run" + action + "_" + happening;
    }

    @Override
    public String startTime(int action, int happening) {
        return "st" + action + "_" + happening;
    }

    @Override
    public String duration(int action, int happening) {
        return "dur" + action + "_" + happening;
    }
}
