package reducer.transforms;

import reducer.hir.AccessExpression;
import reducer.hir.AccessOperator;
import reducer.hir.ArrayAccess;
import reducer.hir.AssignmentExpression;
import reducer.hir.ClassDeclaration;
import reducer.hir.DepthFirstIterator;
import reducer.hir.Expression;
import reducer.hir.IRTools;
import reducer.hir.Identifier;
import reducer.hir.Initializer;
import reducer.hir.IntegerLiteral;
import reducer.hir.PointerSpecifier;
import reducer.hir.PrintTools;
import reducer.hir.Program;
import reducer.hir.Specifier;
import reducer.hir.Symbol;
import reducer.hir.SymbolTools;
import reducer.hir.Traversable;
import reducer.hir.Typecast;
import reducer.hir.UnaryExpression;
import reducer.hir.UnaryOperator;
import reducer.hir.VariableDeclarator;

import java.util.ArrayList;
import java.util.List;

/**
* Removes one pointer level from a selected declarator and adjusts the
* program so that it keeps the same pointer structure everywhere else.
*
* <p>The rewrite has two phases. The first phase rewrites the declarators
* and the uses of the selected entity, and records the places where a value
* of the old type flows into the entity. The second phase adjusts each of
* those values by one level:
* <ul>
* <li><b>&amp;x</b> becomes <b>x</b>,</li>
* <li>a pointer cast loses one pointer specifier,</li>
* <li>the null constant <b>0</b> is kept,</li>
* <li>any other value <b>e</b> becomes <b>*e</b>.</li>
* </ul>
*
* <p>For a use, the chain of dereferences, subscripts and <b>-&gt;</b>
* applied to it is followed. The first indirection after the array
* dimensions of the declaration is the level that disappeared and is removed
* (a subscript is replaced by its base, <b>-&gt;</b> becomes <b>.</b>). A use
* whose chain stops right after the array dimensions now has the reduced type;
* it is the target of an assignment, left alone under <b>&amp;</b>,
* <b>++</b>, <b>--</b> and compound assignments, and otherwise replaced with
* its address.
*/
public class PointerLevelRewriter {

    private static final String pass_name = "[PointerLevelRewriter]";

    private Program program;

    /** The canonical declarator being reduced */
    private VariableDeclarator selected;

    /** The aggregate declaring the selected field, null for variables */
    private ClassDeclaration record_decl;

    /** Number of array dimensions of the selected declarator */
    private int num_dims;

    /** Declarators of the selected entity */
    private List<VariableDeclarator> decl_sites;

    /** References to the selected entity */
    private List<Expression> use_sites;

    /** Aggregate variables with brace-enclosed initializers */
    private List<VariableDeclarator> aggregate_vars;

    /** Values of the old type collected by the first phase */
    private List<Traversable> value_slots;

    /** Assignments whose right-hand side must be adjusted */
    private List<AssignmentExpression> assign_slots;

    /**
    * Creates a rewriter for the selected declarator.
    *
    * @param program the program to be rewritten.
    * @param selected the canonical declarator of the selected entity.
    * @param record_decl the aggregate declaring <b>selected</b> if it is a
    * field, null otherwise.
    */
    public PointerLevelRewriter(Program program, VariableDeclarator selected,
                                ClassDeclaration record_decl) {
        this.program = program;
        this.selected = selected;
        this.record_decl = record_decl;
        num_dims = selected.getArraySpecifiers().size();
        decl_sites = new ArrayList<VariableDeclarator>();
        use_sites = new ArrayList<Expression>();
        aggregate_vars = new ArrayList<VariableDeclarator>();
        value_slots = new ArrayList<Traversable>();
        assign_slots = new ArrayList<AssignmentExpression>();
    }

    /**
    * Performs the rewrite.
    *
    * @throws InternalError if the selected declarator has no pointer level.
    */
    public void rewrite() {
        findSites();
        PrintTools.printlnStatus(2, pass_name, "rewriting",
                selected.getSymbolName() + ":", decl_sites.size(),
                "declarators,", use_sites.size(), "uses");
        for (VariableDeclarator d : decl_sites) {
            rewriteDeclarator(d);
        }
        for (Expression use : use_sites) {
            rewriteUse(use);
        }
        if (record_decl != null) {
            for (VariableDeclarator var : aggregate_vars) {
                rewriteAggregateInitializer(SymbolTools.getVariableType(var),
                        var.getInitializer());
            }
        }
        // The right-hand side is read now since the first phase may have
        // replaced it.
        for (AssignmentExpression ae : assign_slots) {
            value_slots.add(ae.getRHS());
        }
        for (Traversable slot : value_slots) {
            reduceSlot(slot);
        }
    }

    /* Finds every site before anything is mutated */
    private void findSites() {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(program);
        while (iter.hasNext()) {
            Traversable t = iter.next();
            if (t instanceof VariableDeclarator) {
                VariableDeclarator d = (VariableDeclarator)t;
                if (d.getCanonicalDeclarator() == selected) {
                    decl_sites.add(d);
                } else if (record_decl != null && isAggregateVariable(d)) {
                    aggregate_vars.add(d);
                }
            } else if (t instanceof Identifier) {
                Identifier id = (Identifier)t;
                Symbol symbol = id.getSymbol();
                if (symbol instanceof VariableDeclarator &&
                    ((VariableDeclarator)symbol).getCanonicalDeclarator() ==
                    selected) {
                    Traversable parent = id.getParent();
                    if (parent instanceof AccessExpression &&
                        ((AccessExpression)parent).getMember() == id) {
                        use_sites.add((AccessExpression)parent);
                    } else {
                        use_sites.add(id);
                    }
                }
            }
        }
    }

    /* A non-pointer aggregate, or an array of them, with a list initializer */
    private static boolean isAggregateVariable(VariableDeclarator d) {
        Initializer init = d.getInitializer();
        List<Specifier> type = d.getTypeSpecifiers();
        return (init != null && init.isList() &&
                !SymbolTools.isPointer(type) &&
                SymbolTools.getClassDeclaration(type) != null);
    }

    /**
    * Removes the outermost pointer specifier of the declarator and schedules
    * its initializer for adjustment.
    */
    private void rewriteDeclarator(VariableDeclarator d) {
        List<Specifier> specs = d.getSpecifiers();
        int last = -1;
        for (int i = 0; i < specs.size(); i++) {
            if (specs.get(i) instanceof PointerSpecifier) {
                last = i;
            }
        }
        if (last < 0) {
            throw new InternalError("No pointer level to remove from " +
                    d.getSymbolName());
        }
        specs.remove(last);
        if (d.getInitializer() != null) {
            value_slots.add(d.getInitializer());
        }
        PrintTools.printlnStatus(3, pass_name, "declarator:", d);
    }

    private void rewriteUse(Expression use) {
        Expression e = use;
        for (int num_ops = 0; ; num_ops++) {
            Traversable parent = e.getParent();
            Expression next = null;
            if (parent instanceof UnaryExpression &&
                ((UnaryExpression)parent).getOperator() ==
                UnaryOperator.DEREFERENCE) {
                next = (Expression)parent;
            } else if (parent instanceof ArrayAccess &&
                       ((ArrayAccess)parent).getArrayName() == e) {
                next = (Expression)parent;
            } else if (parent instanceof AccessExpression &&
                       ((AccessExpression)parent).getLHS() == e &&
                       ((AccessExpression)parent).getOperator() ==
                       AccessOperator.POINTER_ACCESS) {
                next = (Expression)parent;
            }
            if (next == null) {
                if (num_ops == num_dims) {
                    rewriteValueUse(e);
                }
                return;
            }
            if (num_ops == num_dims) {
                removeIndirection(next, e);
                return;
            }
            e = next;
        }
    }

    /* Removes the indirection op applied to e */
    private void removeIndirection(Expression op, Expression e) {
        if (op instanceof AccessExpression) {
            ((AccessExpression)op).setOperator(AccessOperator.MEMBER_ACCESS);
        } else {
            IRTools.unwrap(op, e);
        }
        PrintTools.printlnStatus(3, pass_name, "use:", e.getStatement());
    }

    /* e now has the reduced type where the old one was used */
    private void rewriteValueUse(Expression e) {
        Traversable parent = e.getParent();
        if (parent instanceof AssignmentExpression &&
            ((AssignmentExpression)parent).getLHS() == e) {
            AssignmentExpression ae = (AssignmentExpression)parent;
            if (!ae.getOperator().isCompound()) {
                assign_slots.add(ae);
            }
            return;
        }
        if (parent instanceof UnaryExpression) {
            UnaryOperator op = ((UnaryExpression)parent).getOperator();
            if (op == UnaryOperator.ADDRESS_OF ||
                UnaryOperator.hasSideEffects(op)) {
                return;
            }
        }
        IRTools.wrap(UnaryOperator.ADDRESS_OF, e);
    }

    /**
    * Walks a brace-enclosed initializer of the given type and schedules every
    * element that initializes the selected field. A union only takes its
    * first member.
    */
    private void rewriteAggregateInitializer(List<Specifier> type,
                                             Traversable init) {
        if (!(init instanceof Initializer) || !((Initializer)init).isList()) {
            return;
        }
        List<Traversable> elems = init.getChildren();
        if (SymbolTools.isArray(type)) {
            List<Specifier> elem_type =
                    new ArrayList<Specifier>(type.subList(0, type.size() - 1));
            for (Traversable elem : elems) {
                rewriteAggregateInitializer(elem_type, elem);
            }
            return;
        }
        if (SymbolTools.getDepth(type) > 0) {
            return;
        }
        ClassDeclaration cdecl = SymbolTools.getClassDeclaration(type);
        if (cdecl == null) {
            return;
        }
        List<VariableDeclarator> fields = cdecl.getFields();
        int num_fields = (cdecl.isUnion()) ?
                Math.min(1, fields.size()) : fields.size();
        for (int i = 0; i < elems.size() && i < num_fields; i++) {
            VariableDeclarator field = fields.get(i);
            if (cdecl == record_decl &&
                field.getCanonicalDeclarator() == selected) {
                value_slots.add(elems.get(i));
            } else {
                rewriteAggregateInitializer(
                        SymbolTools.getVariableType(field), elems.get(i));
            }
        }
    }

    /* Reduces every value under an initializer or the expression itself */
    private void reduceSlot(Traversable slot) {
        if (slot instanceof Expression) {
            reduceValue((Expression)slot);
        } else if (slot instanceof Initializer) {
            Initializer init = (Initializer)slot;
            if (init.isList()) {
                for (Traversable elem :
                        new ArrayList<Traversable>(init.getChildren())) {
                    reduceSlot(elem);
                }
            } else {
                reduceValue(init.getValue());
            }
        }
    }

    /**
    * Turns a value of the old type into a value with one pointer level less.
    *
    * @param e an expression on the IR tree.
    */
    static void reduceValue(Expression e) {
        if (e instanceof UnaryExpression &&
            ((UnaryExpression)e).getOperator() == UnaryOperator.ADDRESS_OF) {
            IRTools.unwrap(e, ((UnaryExpression)e).getExpression());
        } else if (e instanceof Typecast &&
                   SymbolTools.isPointer(((Typecast)e).getSpecifiers())) {
            List<Specifier> specs = ((Typecast)e).getSpecifiers();
            specs.remove(specs.size() - 1);
        } else if (!isNullConstant(e)) {
            IRTools.wrap(UnaryOperator.DEREFERENCE, e);
        }
    }

    /* The null pointer constant fits any pointer type */
    private static boolean isNullConstant(Expression e) {
        return (e instanceof IntegerLiteral &&
                ((IntegerLiteral)e).getValue() == 0);
    }

}
