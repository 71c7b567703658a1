package com.spreadsheet.calc.dependency;

import com.spreadsheet.calc.formula.ArrayLiteral;
import com.spreadsheet.calc.formula.BinaryExpr;
import com.spreadsheet.calc.formula.BooleanLiteral;
import com.spreadsheet.calc.formula.CellReference;
import com.spreadsheet.calc.formula.ErrorLiteral;
import com.spreadsheet.calc.formula.FormulaExpr;
import com.spreadsheet.calc.formula.FormulaVisitor;
import com.spreadsheet.calc.formula.FunctionCall;
import com.spreadsheet.calc.formula.NameReference;
import com.spreadsheet.calc.formula.NumberLiteral;
import com.spreadsheet.calc.formula.RangeReference;
import com.spreadsheet.calc.formula.StringLiteral;
import com.spreadsheet.calc.formula.UnaryExpr;
import com.spreadsheet.calc.functions.FunctionRegistry;
import com.spreadsheet.calc.models.CellRange;
import com.spreadsheet.calc.models.Workbook;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the cells a parsed formula reads.
 * Ranges expand to every cell they cover. Sheet-qualified references resolve through
 * the workbook; an unknown sheet falls back to the current one. Named ranges are not
 * followed.
 */
public final class ReferenceExtractor {

    private ReferenceExtractor() {
    }

    public static Set<CellKey> extract(FormulaExpr expr, int currentSheet, Workbook workbook) {
        Set<CellKey> refs = new LinkedHashSet<>();
        expr.accept(new Collector(refs, currentSheet, workbook));
        return refs;
    }

    /**
     * True when a volatile function (RAND, NOW, ...) is called anywhere in the tree.
     */
    public static boolean containsVolatileFunction(FormulaExpr expr) {
        return expr.accept(new VolatileFinder());
    }

    private static final class Collector implements FormulaVisitor<Void> {
        private final Set<CellKey> refs;
        private final int currentSheet;
        private final Workbook workbook;

        Collector(Set<CellKey> refs, int currentSheet, Workbook workbook) {
            this.refs = refs;
            this.currentSheet = currentSheet;
            this.workbook = workbook;
        }

        private int sheetOf(String name) {
            if (name == null || workbook == null) {
                return currentSheet;
            }
            Integer index = workbook.sheetIndex(name);
            return index == null ? currentSheet : index;
        }

        @Override
        public Void visitNumber(NumberLiteral expr) {
            return null;
        }

        @Override
        public Void visitString(StringLiteral expr) {
            return null;
        }

        @Override
        public Void visitBoolean(BooleanLiteral expr) {
            return null;
        }

        @Override
        public Void visitError(ErrorLiteral expr) {
            return null;
        }

        @Override
        public Void visitCellReference(CellReference expr) {
            refs.add(new CellKey(sheetOf(expr.getSheet()), expr.getAddress().getRow(), expr.getAddress().getCol()));
            return null;
        }

        @Override
        public Void visitRangeReference(RangeReference expr) {
            int sheet = sheetOf(expr.getSheet());
            CellRange range = expr.getRange();
            for (int r = range.getStart().getRow(); r <= range.getEnd().getRow(); r++) {
                for (int c = range.getStart().getCol(); c <= range.getEnd().getCol(); c++) {
                    refs.add(new CellKey(sheet, r, c));
                }
            }
            return null;
        }

        @Override
        public Void visitNameReference(NameReference expr) {
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpr expr) {
            expr.getLeft().accept(this);
            expr.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpr expr) {
            expr.getOperand().accept(this);
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall expr) {
            for (FormulaExpr arg : expr.getArguments()) {
                arg.accept(this);
            }
            return null;
        }

        @Override
        public Void visitArray(ArrayLiteral expr) {
            for (List<FormulaExpr> row : expr.getRows()) {
                for (FormulaExpr item : row) {
                    item.accept(this);
                }
            }
            return null;
        }
    }

    private static final class VolatileFinder implements FormulaVisitor<Boolean> {

        @Override
        public Boolean visitNumber(NumberLiteral expr) {
            return false;
        }

        @Override
        public Boolean visitString(StringLiteral expr) {
            return false;
        }

        @Override
        public Boolean visitBoolean(BooleanLiteral expr) {
            return false;
        }

        @Override
        public Boolean visitError(ErrorLiteral expr) {
            return false;
        }

        @Override
        public Boolean visitCellReference(CellReference expr) {
            return false;
        }

        @Override
        public Boolean visitRangeReference(RangeReference expr) {
            return false;
        }

        @Override
        public Boolean visitNameReference(NameReference expr) {
            return false;
        }

        @Override
        public Boolean visitBinary(BinaryExpr expr) {
            return expr.getLeft().accept(this) || expr.getRight().accept(this);
        }

        @Override
        public Boolean visitUnary(UnaryExpr expr) {
            return expr.getOperand().accept(this);
        }

        @Override
        public Boolean visitFunctionCall(FunctionCall expr) {
            if (FunctionRegistry.getInstance().isVolatile(expr.getName())) {
                return true;
            }
            for (FormulaExpr arg : expr.getArguments()) {
                if (arg.accept(this)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Boolean visitArray(ArrayLiteral expr) {
            for (List<FormulaExpr> row : expr.getRows()) {
                for (FormulaExpr item : row) {
                    if (item.accept(this)) {
                        return true;
                    }
                }
            }
            return false;
        }
    }
}
