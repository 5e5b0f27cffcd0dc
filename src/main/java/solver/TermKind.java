package solver;

import com.microsoft.z3.*;
import com.microsoft.z3.enumerations.Z3_decl_kind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Closed set of term kinds seen by the EF core.
 * Each kind rebuilds a term of the same kind from rewritten children.
 */
public enum TermKind {
    CONSTANT(true) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return original;
        }
    },
    VARIABLE(true) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return original;
        }
    },
    NOT(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 1);
            return ctx.mkNot((BoolExpr) c[0]);
        }
    },
    EQ(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkEq(c[0], c[1]);
        }
    },
    DISTINCT(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return ctx.mkDistinct(c);
        }
    },
    AND(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return ctx.mkAnd(toBool(c));
        }
    },
    OR(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            if (c.length < 2) {
                throw new IllegalArgumentException("or expects at least two children, got " + c.length);
            }
            return ctx.mkOr(toBool(c));
        }
    },
    XOR(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            BoolExpr result = (BoolExpr) c[0];
            for (int i = 1; i < c.length; i++) {
                result = ctx.mkXor(result, (BoolExpr) c[i]);
            }
            return result;
        }
    },
    IMPLIES(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkImplies((BoolExpr) c[0], (BoolExpr) c[1]);
        }
    },
    ITE(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 3);
            // result sort follows the then-branch
            return ctx.mkITE((BoolExpr) c[0], c[1], c[2]);
        }
    },
    BV_UDIV(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVUDiv((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_UREM(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVURem((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SDIV(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSDiv((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SREM(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSRem((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SMOD(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSMod((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SHL(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSHL((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_LSHR(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVLSHR((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_ASHR(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVASHR((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_ULE(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVULE((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_UGE(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVUGE((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SLE(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSLE((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    BV_SGE(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            checkArity(this, c, 2);
            return ctx.mkBVSGE((BitVecExpr) c[0], (BitVecExpr) c[1]);
        }
    },
    APP(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return ctx.mkApp(original.getFuncDecl(), c);
        }
    },
    FORALL(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            throw new UnsupportedOperationException("quantifiers are opened, not rebuilt: " + original);
        }
    },
    EXISTS(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            throw new UnsupportedOperationException("quantifiers are opened, not rebuilt: " + original);
        }
    },
    LAMBDA(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return original;
        }
    },
    OTHER(false) {
        @Override
        public Expr rebuild(Context ctx, Expr original, Expr[] c) {
            return original.update(c);
        }
    };

    private static final Map<Z3_decl_kind, TermKind> DECL_KINDS = new EnumMap<>(Z3_decl_kind.class);

    static {
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_NOT, NOT);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_EQ, EQ);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_IFF, EQ);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_DISTINCT, DISTINCT);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_AND, AND);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_OR, OR);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_XOR, XOR);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_IMPLIES, IMPLIES);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_ITE, ITE);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BUDIV, BV_UDIV);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BUREM, BV_UREM);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BSDIV, BV_SDIV);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BSREM, BV_SREM);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BSMOD, BV_SMOD);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BSHL, BV_SHL);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BLSHR, BV_LSHR);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_BASHR, BV_ASHR);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_ULEQ, BV_ULE);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_UGEQ, BV_UGE);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_SLEQ, BV_SLE);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_SGEQ, BV_SGE);
        DECL_KINDS.put(Z3_decl_kind.Z3_OP_UNINTERPRETED, APP);
    }

    private final boolean atomic;

    TermKind(boolean atomic) {
        this.atomic = atomic;
    }

    public boolean isAtomic() {
        return atomic;
    }

    /**
     * Build a term of this kind with the given children.
     *
     * @param ctx      the owning Z3 context
     * @param original the term being rebuilt, used for its declaration
     * @param c        rewritten children, in the original order
     */
    public abstract Expr rebuild(Context ctx, Expr original, Expr[] c);

    public static TermKind of(Expr t) {
        if (t.isVar()) {
            return VARIABLE;
        }
        if (t.isQuantifier()) {
            // newer bindings wrap lambdas as Lambda, not Quantifier
            if (t instanceof Quantifier) {
                Quantifier q = (Quantifier) t;
                if (q.isUniversal()) {
                    return FORALL;
                }
                if (q.isExistential()) {
                    return EXISTS;
                }
            }
            return LAMBDA;
        }
        if (t.getNumArgs() == 0) {
            return CONSTANT;
        }
        TermKind kind = DECL_KINDS.get(t.getFuncDecl().getDeclKind());
        return kind == null ? OTHER : kind;
    }

    private static void checkArity(TermKind kind, Expr[] c, int expected) {
        if (c.length != expected) {
            throw new IllegalArgumentException(kind + " expects " + expected + " children, got " + c.length);
        }
    }

    private static BoolExpr[] toBool(Expr[] c) {
        BoolExpr[] result = new BoolExpr[c.length];
        for (int i = 0; i < c.length; i++) {
            result[i] = (BoolExpr) c[i];
        }
        return result;
    }
}
