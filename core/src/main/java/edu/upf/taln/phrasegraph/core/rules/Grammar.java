package edu.upf.taln.phrasegraph.core.rules;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.phrasegraph.core.grammar.ComponentType;
import edu.upf.taln.phrasegraph.core.grammar.SlotSpec;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

/**
 * Rule table of a language: head predicates, slot finders and attribute getters for each component type,
 * dispatch of roles and POS tags to component types, dependency classification and coordination rules.
 * Tables are validated once when built, before any sentence is processed.
 * Immutable class.
 */
public final class Grammar
{
	private final String name;
	private final ImmutableMap<ComponentType, HeadPredicate> heads;
	private final ImmutableMap<ComponentType, ImmutableList<SlotSpec>> slots;
	private final ImmutableMap<ComponentType, ImmutableList<SlotRule>> rules;
	private final ImmutableMap<ComponentType, ImmutableMap<String, AttributeGetter>> getters;
	private final ImmutableMap<Role, ComponentType> roles;
	private final ImmutableMap<POS.Tag, ComponentType> tags;
	private final DependencyClassifier classifier;
	private final CoordinationRules coordination;

	private Grammar(Builder b)
	{
		this.name = b.name;
		this.heads = ImmutableMap.copyOf(b.heads);
		ImmutableMap.Builder<ComponentType, ImmutableList<SlotSpec>> slots_builder = ImmutableMap.builder();
		b.slots.forEach((t, s) -> slots_builder.put(t, ImmutableList.copyOf(s.values())));
		this.slots = slots_builder.build();
		ImmutableMap.Builder<ComponentType, ImmutableList<SlotRule>> rules_builder = ImmutableMap.builder();
		b.slots.forEach((t, s) -> rules_builder.put(t, s.keySet().stream()
				.map(n -> b.rules.get(t).get(n))
				.collect(ImmutableList.toImmutableList())));
		this.rules = rules_builder.build();
		ImmutableMap.Builder<ComponentType, ImmutableMap<String, AttributeGetter>> getters_builder = ImmutableMap.builder();
		b.getters.forEach((t, g) -> getters_builder.put(t, ImmutableMap.copyOf(g)));
		this.getters = getters_builder.build();
		this.roles = ImmutableMap.copyOf(b.roles);
		this.tags = ImmutableMap.copyOf(b.tags);
		this.classifier = b.classifier;
		this.coordination = b.coordination;
	}

	public static Builder builder(String name) { return new Builder(name); }

	public String getName() { return name; }
	public boolean isHead(ComponentType type, Token tok) { return heads.get(type).isHead(tok); }

	/**
	 * @return declared slots of the type, in the order their finders are tried
	 */
	public List<SlotSpec> getSlots(ComponentType type) { return slots.get(type); }
	public List<SlotRule> getSlotRules(ComponentType type) { return rules.get(type); }
	public Map<String, AttributeGetter> getGetters(ComponentType type) { return getters.get(type); }
	public DependencyClassifier getClassifier() { return classifier; }
	public CoordinationRules getCoordination() { return coordination; }

	/**
	 * @return component type registered for the role, else for the POS tag, else the fallback
	 */
	public ComponentType dispatch(Role role, POS.Tag pos, ComponentType fallback)
	{
		if (role != null && roles.containsKey(role))
			return roles.get(role);
		return tags.getOrDefault(pos, fallback);
	}

	@Override
	public String toString() { return "Grammar " + name; }

	public static final class Builder
	{
		private final static Logger log = LogManager.getLogger();
		private final String name;
		private final Map<ComponentType, HeadPredicate> heads = new EnumMap<>(ComponentType.class);
		private final Map<ComponentType, LinkedHashMap<String, SlotSpec>> slots = new EnumMap<>(ComponentType.class);
		private final Map<ComponentType, Map<String, SlotRule>> rules = new EnumMap<>(ComponentType.class);
		private final Map<ComponentType, Map<String, AttributeGetter>> getters = new EnumMap<>(ComponentType.class);
		private final Map<Role, ComponentType> roles = new EnumMap<>(Role.class);
		private final Map<POS.Tag, ComponentType> tags = new EnumMap<>(POS.Tag.class);
		private DependencyClassifier classifier = null;
		private CoordinationRules coordination = null;

		private Builder(String name)
		{
			this.name = name;
			for (ComponentType type : ComponentType.values())
			{
				final LinkedHashMap<String, SlotSpec> specs = new LinkedHashMap<>();
				type.getSlots().forEach(s -> specs.put(s.getName(), s));
				slots.put(type, specs);
				rules.put(type, new HashMap<>());
				getters.put(type, new LinkedHashMap<>());
			}
		}

		public Builder head(ComponentType type, HeadPredicate predicate)
		{
			if (heads.put(type, predicate) != null)
				throw new IllegalStateException(name + ": duplicate head predicate for " + type.getAlias());
			return this;
		}

		/**
		 * Declares a language-specific slot for a component type.
		 */
		public Builder declare(ComponentType type, SlotSpec spec)
		{
			if (slots.get(type).containsKey(spec.getName()))
				throw new IllegalStateException(name + ": slot " + spec.getName() + " already declared for " + type.getAlias());
			slots.get(type).put(spec.getName(), spec);
			return this;
		}

		public Builder rule(ComponentType type, SlotRule rule)
		{
			if (!slots.get(type).containsKey(rule.getName()))
				throw new IllegalStateException(name + ": rule for undeclared slot " + rule.getName() + " of " + type.getAlias());
			if (rules.get(type).put(rule.getName(), rule) != null)
				throw new IllegalStateException(name + ": duplicate rule for slot " + rule.getName() + " of " + type.getAlias());
			return this;
		}

		/**
		 * Adds a rule for the same slot to all component types.
		 */
		public Builder rule(SlotRule rule)
		{
			for (ComponentType type : ComponentType.values())
				rule(type, rule);
			return this;
		}

		public Builder getter(ComponentType type, String attribute, AttributeGetter getter)
		{
			if (!type.getAttributeNames().contains(attribute))
				throw new IllegalStateException(name + ": getter for undeclared attribute " + attribute + " of " + type.getAlias());
			if (getters.get(type).put(attribute, getter) != null)
				throw new IllegalStateException(name + ": duplicate getter for attribute " + attribute + " of " + type.getAlias());
			return this;
		}

		public Builder role(Role role, ComponentType type)
		{
			final ComponentType current = roles.put(role, type);
			if (current != null && current != type)
				throw new IllegalStateException(name + ": role " + role + " already dispatched to " + current.getAlias());
			return this;
		}

		public Builder tag(POS.Tag tag, ComponentType type)
		{
			final ComponentType current = tags.put(tag, type);
			if (current != null && current != type)
				throw new IllegalStateException(name + ": POS tag " + tag + " already dispatched to " + current.getAlias());
			return this;
		}

		/**
		 * Dispatches the default role and POS tags of every component type.
		 */
		public Builder defaultDispatch()
		{
			for (ComponentType type : ComponentType.values())
			{
				role(type.getRole(), type);
				type.getTags().forEach(t -> tag(t, type));
			}
			return this;
		}

		public Builder classifier(DependencyClassifier classifier)
		{
			this.classifier = classifier;
			return this;
		}

		public Builder coordination(CoordinationRules coordination)
		{
			this.coordination = coordination;
			return this;
		}

		/**
		 * @throws IllegalStateException if a head predicate, slot rule or attribute getter is missing
		 */
		public Grammar build()
		{
			for (ComponentType type : ComponentType.values())
			{
				if (!heads.containsKey(type))
					throw new IllegalStateException(name + ": missing head predicate for " + type.getAlias());

				final List<String> missing_rules = new ArrayList<>(slots.get(type).keySet());
				missing_rules.removeAll(rules.get(type).keySet());
				if (!missing_rules.isEmpty())
					throw new IllegalStateException(name + ": missing slot rules for " + type.getAlias() + ": " + missing_rules);

				final List<String> missing_getters = new ArrayList<>(type.getAttributeNames());
				missing_getters.removeAll(getters.get(type).keySet());
				if (!missing_getters.isEmpty())
					throw new IllegalStateException(name + ": missing attribute getters for " + type.getAlias() + ": " + missing_getters);
			}
			if (classifier == null)
				throw new IllegalStateException(name + ": missing dependency classifier");
			if (coordination == null)
				throw new IllegalStateException(name + ": missing coordination rules");

			log.debug("Built grammar " + name + " with slots " + slots);
			return new Grammar(this);
		}
	}
}
