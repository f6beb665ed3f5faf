/**
 *
 */
package org.theseed.regflux.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.theseed.regflux.expr.ArithmeticResolver;
import org.theseed.regflux.expr.ExprNode;
import org.theseed.regflux.expr.Grammar;
import org.theseed.regflux.expr.TreeBuilder;

/**
 * This object represents the kinetic rate law of a reaction:  an arithmetic expression over
 * metabolite concentrations and kinetic parameters.  Named functions defined elsewhere in a
 * kinetic model can be supplied as expression trees; each call to such a function in the law
 * is replaced by the function body when the law is parsed.
 *
 */
public class RateLaw {

    // FIELDS
    /** ID of the reaction */
    private String id;
    /** text of the rate law */
    private String law;
    /** local parameter values */
    private Map<String, Double> parameters;
    /** named functions to inline */
    private Map<String, ExprNode> functions;
    /** stoichiometry of the reaction */
    private Map<String, Double> stoichiometry;
    /** parsed law (built on first use) */
    private ExprNode tree;

    /** names that evaluate as constants rather than parameters */
    private static final Set<String> CONSTANTS = Set.of("pi", "e");

    /**
     * Construct a rate law with no parameters or functions.
     *
     * @param id		ID of the reaction
     * @param law		arithmetic expression for the rate
     */
    public RateLaw(String id, String law) {
        this(id, law, Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * Construct a rate law.
     *
     * @param id			ID of the reaction
     * @param law			arithmetic expression for the rate
     * @param parameters	local parameter values
     * @param functions		map of function names to function bodies
     */
    public RateLaw(String id, String law, Map<String, Double> parameters, Map<String, ExprNode> functions) {
        this.id = id;
        this.law = law;
        this.parameters = new LinkedHashMap<String, Double>(parameters);
        this.functions = new HashMap<String, ExprNode>(functions);
        this.stoichiometry = new LinkedHashMap<String, Double>();
        this.tree = null;
    }

    /**
     * @return the parsed rate law, with the named functions inlined
     */
    public ExprNode getTree() {
        if (this.tree == null) {
            this.tree = TreeBuilder.buildTree(this.law, Grammar.ARITHMETIC);
            if (! this.functions.isEmpty())
                this.tree.replaceNodes(this.functions);
        }
        return this.tree;
    }

    /**
     * @return the names of the parameters and concentrations used by the law
     */
    public Set<String> parameters() {
        Set<String> retVal = new TreeSet<String>(this.getTree().getParameters());
        retVal.removeAll(CONSTANTS);
        return retVal;
    }

    /**
     * Rename a parameter in both the law and the local parameter table.
     *
     * @param oldName	current parameter name
     * @param newName	new parameter name
     */
    public void renameParameter(String oldName, String newName) {
        if (this.parameters().contains(oldName)) {
            ExprNode renamed = this.getTree().replace(Map.of(oldName, newName));
            this.law = renamed.toInfix();
            this.tree = null;
        }
        Double value = this.parameters.remove(oldName);
        if (value != null)
            this.parameters.put(newName, value);
    }

    /**
     * Substitute values into the law.
     *
     * @param values	map of names to replacement values
     * @param local		TRUE to also substitute the local parameter values (which take priority)
     *
     * @return a new tree with the substitutions made
     */
    public ExprNode substitute(Map<String, Double> values, boolean local) {
        Map<String, String> mapping = new HashMap<String, String>();
        values.forEach((k, v) -> mapping.put(k, v.toString()));
        if (local)
            this.parameters.forEach((k, v) -> mapping.put(k, v.toString()));
        return this.getTree().replace(mapping);
    }

    /**
     * @return the law in infix form, with values substituted
     *
     * @param values	map of names to replacement values
     */
    public String toInfix(Map<String, Double> values) {
        return this.substitute(values, true).toInfix();
    }

    /**
     * @return the law in LaTeX form, with values substituted
     *
     * @param values	map of names to replacement values
     */
    public String toLatex(Map<String, Double> values) {
        return this.substitute(values, true).toLatex().getText();
    }

    /**
     * Compute the reaction rate.  Values are taken from the local parameters, then the
     * substrate concentrations, then the caller's parameters, with later sources overriding
     * earlier ones.
     *
     * @param substrates	map of metabolite IDs to concentrations
     * @param params		map of parameter names to values
     *
     * @return the computed rate
     *
     * @throws IllegalArgumentException if a value is missing for any parameter of the law
     */
    public double calculateRate(Map<String, Double> substrates, Map<String, Double> params) {
        Map<String, Double> values = new HashMap<String, Double>(this.parameters);
        values.putAll(substrates);
        values.putAll(params);
        List<String> missing = new ArrayList<String>();
        for (String parm : this.parameters()) {
            if (! values.containsKey(parm))
                missing.add(parm);
        }
        if (! missing.isEmpty())
            throw new IllegalArgumentException("Values missing for parameters " + missing + " in rate law of " + this.id + ".");
        return this.getTree().evaluate(new ArithmeticResolver(values));
    }

    /**
     * Specify the stoichiometric coefficient of a metabolite.
     *
     * @param metabolite	ID of the metabolite
     * @param coeff			coefficient (negative for a substrate)
     *
     * @return this object, for chaining
     */
    public RateLaw setStoichiometry(String metabolite, double coeff) {
        this.stoichiometry.put(metabolite, coeff);
        return this;
    }

    /**
     * @return the IDs of the substrates (metabolites with negative coefficients)
     */
    public List<String> getSubstrates() {
        List<String> retVal = new ArrayList<String>();
        this.stoichiometry.forEach((k, v) -> { if (v < 0) retVal.add(k); });
        return retVal;
    }

    /**
     * @return the IDs of the products (metabolites with positive coefficients)
     */
    public List<String> getProducts() {
        List<String> retVal = new ArrayList<String>();
        this.stoichiometry.forEach((k, v) -> { if (v > 0) retVal.add(k); });
        return retVal;
    }

    /**
     * @return the local parameter values
     */
    public Map<String, Double> getParameters() {
        return Collections.unmodifiableMap(this.parameters);
    }

    /**
     * @return the text of the law
     */
    public String getLaw() {
        return this.law;
    }

    /**
     * @return the ID of the reaction
     */
    public String getId() {
        return this.id;
    }

    @Override
    public String toString() {
        return this.law.replace(" ", "");
    }

}
