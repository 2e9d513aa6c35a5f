package edu.upf.taln.phrasegraph.core.grammar;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.phrasegraph.core.symbols.Modal;
import edu.upf.taln.phrasegraph.core.symbols.Mood;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.symbols.Tense;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import edu.upf.taln.phrasegraph.core.utils.POS;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * The four kinds of components, with their serialization alias, default role, the POS tags they are
 * dispatched from, their language-independent slots and their attributes.
 */
public enum ComponentType
{
	VERB("Verb", Role.VERB, ImmutableList.of(POS.Tag.VERB, POS.Tag.AUX), ImmutableList.of(),
			ImmutableMap.of("tense", Tense::fromName, "modal", Modal::fromName, "mood", Mood::fromName))
	{
		@Override
		public Component create(Sentence sentence, Token tok, Role role, List<SlotSpec> slots)
		{
			return new Verb(sentence, tok, role, slots);
		}
	},
	NOUN("Noun", Role.NOUN, ImmutableList.of(POS.Tag.NOUN, POS.Tag.PROPN, POS.Tag.PRON),
			ImmutableList.of(SlotSpec.single("det")), ImmutableMap.of())
	{
		@Override
		public Component create(Sentence sentence, Token tok, Role role, List<SlotSpec> slots)
		{
			return new Noun(sentence, tok, role, slots);
		}
	},
	PREP("Prep", Role.PREP, ImmutableList.of(POS.Tag.ADP), ImmutableList.of(SlotSpec.multi("preps")), ImmutableMap.of())
	{
		@Override
		public Component create(Sentence sentence, Token tok, Role role, List<SlotSpec> slots)
		{
			return new Prep(sentence, tok, role, slots);
		}
	},
	DESC("Desc", Role.DESC, ImmutableList.of(POS.Tag.ADJ, POS.Tag.ADV),
			ImmutableList.of(SlotSpec.multi("mod"), SlotSpec.single("det")), ImmutableMap.of())
	{
		@Override
		public Component create(Sentence sentence, Token tok, Role role, List<SlotSpec> slots)
		{
			return new Desc(sentence, tok, role, slots);
		}
	};

	// Slots shared by all component types
	public static final List<SlotSpec> common_slots = ImmutableList.of(
			SlotSpec.single("qmark"), SlotSpec.single("exclam"), SlotSpec.single("intj"), SlotSpec.single("neg"));

	private final String alias;
	private final Role role;
	private final List<POS.Tag> tags;
	private final List<SlotSpec> slots;
	private final Map<String, Function<String, Enum<?>>> attributes;

	ComponentType(String alias, Role role, List<POS.Tag> tags, List<SlotSpec> slots,
	              Map<String, Function<String, Enum<?>>> attributes)
	{
		this.alias = alias;
		this.role = role;
		this.tags = tags;
		this.slots = slots;
		this.attributes = attributes;
	}

	public abstract Component create(Sentence sentence, Token tok, Role role, List<SlotSpec> slots);

	public String getAlias() { return alias; }
	public Role getRole() { return role; }
	public List<POS.Tag> getTags() { return tags; }

	/**
	 * @return common slots followed by the slots specific to this type
	 */
	public List<SlotSpec> getSlots()
	{
		return ImmutableList.<SlotSpec>builder().addAll(common_slots).addAll(slots).build();
	}

	public List<String> getAttributeNames() { return ImmutableList.copyOf(attributes.keySet()); }

	public Enum<?> parseAttribute(String name, String value)
	{
		final Function<String, Enum<?>> parser = attributes.get(name);
		if (parser == null)
			throw new IllegalArgumentException(alias + " components have no attribute " + name);
		return parser.apply(value);
	}

	public static ComponentType fromAlias(String alias)
	{
		return Arrays.stream(values())
				.filter(t -> t.alias.equals(alias))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown component type " + alias));
	}
}
