package org.lokray.fbs.semantic;

import org.lokray.fbs.ast.Literal;
import org.lokray.fbs.ast.ScalarKind;
import org.lokray.fbs.diagnostic.SemanticError;
import org.lokray.fbs.diagnostic.SourcePosition;
import org.lokray.fbs.ir.IrEnum;
import org.lokray.fbs.ir.IrEnumValue;
import org.lokray.fbs.ir.ScalarValue;
import org.lokray.fbs.util.ErrorHandler;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Converts written constants to typed {@link ScalarValue}s: field defaults,
 * enum values and integer attribute values.
 */
public class DefaultValueConverter
{
	private final ErrorHandler errorHandler;

	public DefaultValueConverter(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * Parses a decimal or {@code 0x} hexadecimal integer with optional sign.
	 *
	 * @throws NumberFormatException if the text is not an integer literal.
	 */
	public static BigInteger parseInteger(String text)
	{
		String digits = text;
		boolean negative = false;
		if (digits.startsWith("-") || digits.startsWith("+"))
		{
			negative = digits.charAt(0) == '-';
			digits = digits.substring(1);
		}
		BigInteger value;
		if (digits.startsWith("0x") || digits.startsWith("0X"))
		{
			value = new BigInteger(digits.substring(2), 16);
		}
		else
		{
			value = new BigInteger(digits);
		}
		return negative ? value.negate() : value;
	}

	/**
	 * Parses a float literal, including {@code nan}, {@code inf} and {@code infinity}.
	 */
	public static double parseFloat(String text)
	{
		String lower = text.toLowerCase();
		boolean negative = lower.startsWith("-");
		String body = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
		return switch (body)
		{
			case "nan" -> Double.NaN;
			case "inf", "infinity" -> negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
			default -> Double.parseDouble(lower);
		};
	}

	/**
	 * Whether a bare word is one of the float spellings {@code nan}, {@code inf} and {@code infinity}.
	 */
	public static boolean isSpecialFloat(String word)
	{
		return word.equals("nan") || word.equals("inf") || word.equals("infinity");
	}

	/**
	 * Converts a default for a plain scalar field.
	 *
	 * @return the value, or {@code null} after reporting why it does not fit.
	 */
	public ScalarValue convert(Literal literal, ScalarKind kind, SourcePosition position, String fieldName)
	{
		switch (literal.getKind())
		{
			case BOOLEAN:
				if (kind == ScalarKind.BOOL)
				{
					return ScalarValue.ofBoolean(Boolean.parseBoolean(literal.getText()));
				}
				break;
			case INTEGER:
				return convertInteger(literal.getText(), kind, position, fieldName);
			case IDENTIFIER:
				if (!kind.isFloatingPoint() || !isSpecialFloat(literal.getText()))
				{
					break;
				}
				return ScalarValue.ofDouble(kind, parseFloat(literal.getText()));
			case FLOAT:
				if (kind.isFloatingPoint())
				{
					double value = parseFloat(literal.getText());
					if (kind == ScalarKind.FLOAT && Double.isFinite(value) && Float.isInfinite((float) value))
					{
						return invalid(position, "Default " + literal.getText() + " of field '" + fieldName + "' is out of range for float");
					}
					return ScalarValue.ofDouble(kind, value);
				}
				break;
			default:
				break;
		}
		return invalid(position, "Default " + literal + " of field '" + fieldName + "' is not a valid " + kind.getKeyword());
	}

	/**
	 * Converts a default for an enum-typed field: an enumerator name or one of the enum's values.
	 */
	public ScalarValue convertEnum(Literal literal, IrEnum irEnum, SourcePosition position, String fieldName)
	{
		ScalarKind kind = irEnum.getUnderlyingType();
		if (literal.getKind() == Literal.Kind.IDENTIFIER)
		{
			Optional<IrEnumValue> value = irEnum.findByName(literal.getText());
			if (value.isEmpty())
			{
				return invalid(position, "'" + literal.getText() + "' is not a value of enum " + irEnum.getFullyQualifiedName()
						+ " (default of field '" + fieldName + "')");
			}
			return ScalarValue.ofLong(kind, value.get().getValue());
		}
		if (literal.getKind() == Literal.Kind.INTEGER)
		{
			ScalarValue value = convertInteger(literal.getText(), kind, position, fieldName);
			if (value != null && irEnum.findByValue(value.asLong()).isEmpty())
			{
				return invalid(position, "Default " + literal.getText() + " of field '" + fieldName + "' is not a value of enum "
						+ irEnum.getFullyQualifiedName());
			}
			return value;
		}
		return invalid(position, "Default " + literal + " of field '" + fieldName + "' is not a value of enum " + irEnum.getFullyQualifiedName());
	}

	private ScalarValue convertInteger(String text, ScalarKind kind, SourcePosition position, String fieldName)
	{
		BigInteger value;
		try
		{
			value = parseInteger(text);
		}
		catch (NumberFormatException e)
		{
			return invalid(position, "Malformed integer " + text + " for field '" + fieldName + "'");
		}

		if (kind.isFloatingPoint())
		{
			return ScalarValue.ofDouble(kind, value.doubleValue());
		}
		if (kind == ScalarKind.BOOL)
		{
			if (value.equals(BigInteger.ZERO) || value.equals(BigInteger.ONE))
			{
				return ScalarValue.ofBoolean(value.signum() != 0);
			}
			return invalid(position, "Default " + text + " of field '" + fieldName + "' is not a valid bool");
		}
		if (!kind.fits(value))
		{
			return invalid(position, "Default " + text + " of field '" + fieldName + "' does not fit in " + kind.getKeyword());
		}
		return ScalarValue.ofLong(kind, value.longValue());
	}

	private ScalarValue invalid(SourcePosition position, String message)
	{
		errorHandler.report(new SemanticError(position, SemanticError.Kind.INVALID_DEFAULT_FOR_TYPE, message));
		return null;
	}
}
