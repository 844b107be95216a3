package org.propositions.infix;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.propositions.infix.LogicFormulaParser.AndContext;
import org.propositions.infix.LogicFormulaParser.FalseContext;
import org.propositions.infix.LogicFormulaParser.FormulaContext;
import org.propositions.infix.LogicFormulaParser.IdContext;
import org.propositions.infix.LogicFormulaParser.ImpliesContext;
import org.propositions.infix.LogicFormulaParser.NotContext;
import org.propositions.infix.LogicFormulaParser.OrContext;
import org.propositions.infix.LogicFormulaParser.ParContext;
import org.propositions.infix.LogicFormulaParser.TrueContext;
import org.propositions.infix.LogicFormulaParser.VarContext;
import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaTokens;

import java.util.logging.Logger;

/**
 * LETTORE NOTAZIONE INFISSA - Convertitore da albero sintattico ANTLR a {@link Formula}
 *
 * Accetta formule scritte a mano, con spazi e senza parentesi obbligatorie,
 * e le traduce nella rappresentazione standard completamente parentesizzata.
 *
 * OPERATORI SUPPORTATI (in ordine di precedenza crescente):
 * - Implicazione (-&gt;): associativa a destra, A -&gt; B -&gt; C ~ (A-&gt;(B-&gt;C))
 * - Disgiunzione (|): associativa a sinistra
 * - Congiunzione (&amp;): associativa a sinistra
 * - Negazione (~ oppure !): prefissa
 * - Variabili (p..z con cifre), costanti T e F, parentesi
 *
 * ESEMPIO: "p &amp; q | ~r -&gt; s" -&gt; (((p&amp;q)|~r)-&gt;s)
 */
public class InfixFormulaReader extends LogicFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(InfixFormulaReader.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Interpreta una formula in notazione infissa.
     *
     * @param text formula infissa
     * @return formula corrispondente
     * @throws IllegalArgumentException se il testo non rispetta la grammatica
     */
    public static Formula read(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo della formula non può essere null");
        }

        LogicFormulaLexer lexer = new LogicFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FailFastErrorListener.INSTANCE);

        LogicFormulaParser parser = new LogicFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(FailFastErrorListener.INSTANCE);

        try {
            ParseTree tree = parser.formula();
            Formula formula = new InfixFormulaReader().visit(tree);
            LOGGER.fine("Formula infissa '" + text + "' -> " + formula);
            return formula;
        } catch (ParseCancellationException e) {
            throw new IllegalArgumentException("Formula infissa non valida '" + text + "': " + e.getMessage(), e);
        }
    }

    /**
     * Predicato totale sulla notazione infissa.
     */
    public static boolean isInfixFormula(String text) {
        try {
            read(text);
            return true;
        } catch (IllegalArgumentException e) {
            LOGGER.finest("Testo infisso rifiutato: " + e.getMessage());
            return false;
        }
    }

    //endregion

    //region VISITA DELLE REGOLE

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    /**
     * A -&gt; B, ricorsiva a destra per l'associatività.
     */
    @Override
    public Formula visitImplies(ImpliesContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.IMPLIES() == null) {
            return antecedent;
        }
        return new Formula(FormulaTokens.IMPLIES, antecedent, visit(ctx.implication()));
    }

    /**
     * A | B | C -&gt; ((A|B)|C)
     */
    @Override
    public Formula visitOr(OrContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = new Formula(FormulaTokens.OR, result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    /**
     * A &amp; B &amp; C -&gt; ((A&amp;B)&amp;C)
     */
    @Override
    public Formula visitAnd(AndContext ctx) {
        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = new Formula(FormulaTokens.AND, result, visit(ctx.negation(i)));
        }
        return result;
    }

    @Override
    public Formula visitNot(NotContext ctx) {
        return Formula.not(visit(ctx.negation()));
    }

    @Override
    public Formula visitVar(VarContext ctx) {
        return visit(ctx.atom());
    }

    @Override
    public Formula visitPar(ParContext ctx) {
        return visit(ctx.implication());
    }

    @Override
    public Formula visitTrue(TrueContext ctx) {
        return new Formula(FormulaTokens.TRUE);
    }

    @Override
    public Formula visitFalse(FalseContext ctx) {
        return new Formula(FormulaTokens.FALSE);
    }

    @Override
    public Formula visitId(IdContext ctx) {
        return new Formula(ctx.IDENTIFIER().getText());
    }

    //endregion

    /**
     * Interrompe lexing e parsing al primo errore sintattico, invece del recupero di default.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            throw new ParseCancellationException("riga " + line + ":" + charPositionInLine + " " + msg);
        }
    }
}
