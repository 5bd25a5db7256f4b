/* @LICENSE@
 */

package org.regal.regex;

import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.regal.regex.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractRxTestCase(String name) {
        super(name);
    }

    private Logger rxLogger = Logger.getLogger("org.regal.regex");
    private Level rxLevel = null;
    private Handler rxHandler = null;

    /*
     * turns on library logging to the console for the current test only
     */
    protected void logRx(Level level) {
        if (rxHandler != null) return;
        rxLevel = rxLogger.getLevel();
        rxHandler = new ConsoleHandler();
        rxHandler.setLevel(level);
        rxHandler.setFormatter(new SimpleFormatter());
        rxLogger.setLevel(level);
        rxLogger.addHandler(rxHandler);
    }
    protected void logRx() {
        logRx(level);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(this.getClass().getSimpleName(), this.getName());
    }

    protected void tearDown() throws Exception {
        if (rxHandler != null) {
            rxHandler.flush();
            rxLogger.removeHandler(rxHandler);
            rxLogger.setLevel(rxLevel);
            rxHandler = null;
        }
        logger.exiting(this.getClass().getSimpleName(), this.getName());
        super.tearDown();
    }

    protected static final String EPSILON = String.valueOf(Misc.EPSILON);
    protected static final String EMPTY = String.valueOf(Misc.EMPTY);

    /**
     * The a*b* automaton: <code>0-a-&gt;0, 0-&#x03B5;-&gt;1, 1-b-&gt;1</code>,
     * final {1}.
     */
    protected static NFA aStarbStarNFA() {
        return new NFA(2)
            .addTransition(0, 'a', 0)
            .addEpsilonTransition(0, 1)
            .addTransition(1, 'b', 1)
            .addFinalState(1);
    }

    /**
     * The a*bb* automaton: <code>0-a-&gt;0, 0-b-&gt;1, 1-b-&gt;1</code>,
     * final {1}.
     */
    protected static DFA aStarbbStarDFA() {
        return new DFA(2)
            .addTransition(0, 'a', 0)
            .addTransition(0, 'b', 1)
            .addTransition(1, 'b', 1)
            .addFinalState(1);
    }

    protected static DFA dfa(String regex) {
        return NFA.thompson(regex).toDFA();
    }
}
