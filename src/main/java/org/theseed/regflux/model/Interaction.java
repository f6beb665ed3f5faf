/**
 *
 */
package org.theseed.regflux.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * An interaction determines the next value of a single target (a regulator, gene, reaction
 * or metabolite) from an ordered list of regulatory events.  The first event whose rule
 * holds supplies the target's value.  If no event holds, the value is 0.
 *
 * Event order matters:  a catch-all event such as "(0, 1)" placed last acts as a default.
 *
 */
public class Interaction {

    // FIELDS
    /** ID of the target */
    private final String target;
    /** ordered list of events */
    private final List<RegulatoryEvent> events;

    /**
     * Construct an interaction with no events.
     *
     * @param target	ID of the target
     */
    public Interaction(String target) {
        this.target = target;
        this.events = new ArrayList<RegulatoryEvent>();
    }

    /**
     * Add an event to the end of the event list.
     *
     * @param coefficient	coefficient to assign when the rule holds
     * @param rule			Boolean rule text
     *
     * @return this object, for chaining
     */
    public Interaction addEvent(double coefficient, String rule) {
        this.events.add(new RegulatoryEvent(coefficient, rule));
        return this;
    }

    /**
     * @return the ID of the target
     */
    public String getTarget() {
        return this.target;
    }

    /**
     * @return the ordered event list
     */
    public List<RegulatoryEvent> getEvents() {
        return Collections.unmodifiableList(this.events);
    }

    /**
     * @return the set of identifiers mentioned by this interaction's rules
     */
    public Set<String> getRegulators() {
        Set<String> retVal = new TreeSet<String>();
        for (RegulatoryEvent event : this.events)
            retVal.addAll(event.getTree().getOperands());
        return retVal;
    }

    /**
     * Compute the next value of the target.
     *
     * @param active		identifiers currently active
     * @param variables		current state values, for relational conditions
     *
     * @return the coefficient of the first triggered event, or 0 if none is triggered
     */
    public double evaluate(Collection<String> active, Map<String, Double> variables) {
        double retVal = 0.0;
        boolean found = false;
        for (int i = 0; i < this.events.size() && ! found; i++) {
            RegulatoryEvent event = this.events.get(i);
            if (event.isTriggered(active, variables)) {
                retVal = event.getCoefficient();
                found = true;
            }
        }
        return retVal;
    }

    @Override
    public String toString() {
        return this.target + " = " + this.events;
    }

}
