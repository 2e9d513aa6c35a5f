package edu.upf.taln.phrasegraph.core.grammar;

import com.google.common.collect.ImmutableList;
import edu.upf.taln.phrasegraph.core.structures.Registry;
import edu.upf.taln.phrasegraph.core.symbols.Role;
import edu.upf.taln.phrasegraph.core.tokens.Document;
import edu.upf.taln.phrasegraph.core.tokens.Token;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A group of tokens controlled by a head token, e.g. a verb with its auxiliaries or a noun with its determiner.
 * Controlled tokens are stored in named slots; tokens attached to the head but not controlled by it are kept
 * as sub tokens.
 * Components are identified by the index of their head token and are canonical within their sentence.
 */
public abstract class Component implements Comparable<Component>, Registry.Canonical<Integer, Component>
{
	private final Sentence sentence;
	private final Token tok;
	private Role role;
	private List<Token> sub = new ArrayList<>();
	private final Map<String, SlotSpec> specs = new LinkedHashMap<>();
	private final Map<String, List<Token>> slots = new LinkedHashMap<>(); // only non-empty slots
	private final Map<String, Enum<?>> attributes = new LinkedHashMap<>();

	protected Component(Sentence sentence, Token tok, Role role, Collection<SlotSpec> specs)
	{
		this.sentence = Objects.requireNonNull(sentence);
		this.tok = Objects.requireNonNull(tok);
		this.role = role != null ? role : getType().getRole();
		specs.forEach(this::declare);
	}

	public abstract ComponentType getType();

	public Sentence getSentence() { return sentence; }
	public Token getToken() { return tok; }
	public int getIndex() { return tok.getIndex(); }
	public Role getRole() { return role; }

	@Override
	public Integer getKey() { return getIndex(); }

	// Slots

	void declare(SlotSpec spec)
	{
		final SlotSpec current = specs.get(spec.getName());
		if (current != null && !current.equals(spec))
			throw new IllegalArgumentException("Slot " + spec.getName() + " already declared as " + current);
		specs.put(spec.getName(), spec);
	}

	public Collection<SlotSpec> getSlotSpecs() { return Collections.unmodifiableCollection(specs.values()); }
	public boolean hasSlot(String name) { return specs.containsKey(name); }

	/**
	 * @return tokens in the slot, possibly empty
	 */
	public List<Token> getSlot(String name)
	{
		return slots.getOrDefault(name, ImmutableList.of());
	}

	/**
	 * @return first token in the slot or null
	 */
	public Token getSlotToken(String name)
	{
		final List<Token> tokens = getSlot(name);
		return tokens.isEmpty() ? null : tokens.get(0);
	}

	public void setSlot(String name, Collection<Token> tokens)
	{
		final SlotSpec spec = specs.get(name);
		if (spec == null)
			throw new IllegalArgumentException(getType().getAlias() + " component has no slot " + name);
		if (!spec.isMulti() && tokens.size() > 1)
			throw new IllegalArgumentException("Slot " + name + " takes a single token, got " + tokens);

		if (tokens.isEmpty())
			slots.remove(name);
		else
			slots.put(name, ImmutableList.copyOf(tokens));
	}

	public Map<String, List<Token>> getSlots() { return Collections.unmodifiableMap(slots); }

	public Token getQmark() { return getSlotToken("qmark"); }
	public Token getExclam() { return getSlotToken("exclam"); }
	public Token getIntj() { return getSlotToken("intj"); }
	public Token getNeg() { return getSlotToken("neg"); }

	public List<Token> getSub() { return Collections.unmodifiableList(sub); }
	public void setSub(Collection<Token> tokens) { sub = new ArrayList<>(tokens); }

	public void addSub(Token token)
	{
		if (!sub.contains(token))
			sub.add(token);
	}

	// Attributes

	public Enum<?> getAttribute(String name) { return attributes.get(name); }
	public Map<String, Enum<?>> getAttributes() { return Collections.unmodifiableMap(attributes); }

	public void setAttribute(String name, Enum<?> value)
	{
		if (!getType().getAttributeNames().contains(name))
			throw new IllegalArgumentException(getType().getAlias() + " components have no attribute " + name);
		attributes.put(name, Objects.requireNonNull(value));
	}

	// Tokens

	/**
	 * @return head and controlled tokens, in textual order
	 */
	public List<Token> getTokens()
	{
		return Stream.concat(Stream.of(tok), slots.values().stream().flatMap(List::stream))
				.distinct()
				.sorted()
				.collect(Collectors.toList());
	}

	/**
	 * @return head, controlled and sub tokens, in textual order
	 */
	public List<Token> getSubtokens()
	{
		return Stream.concat(getTokens().stream(), sub.stream())
				.distinct()
				.sorted()
				.collect(Collectors.toList());
	}

	public boolean contains(Token t) { return getSubtokens().contains(t); }

	// Sentence-level relations

	public Phrase getPhrase() { return sentence.getPhrase(getIndex()); }

	/**
	 * @return head component of the lead phrase
	 */
	public Component getLead() { return getPhrase().getLead().getComponent(); }
	public boolean isLead() { return getPhrase().isLead(); }

	/**
	 * @return components conjoined with this one, excluding it
	 */
	public List<Component> getConjuncts()
	{
		return getPhrase().getConjuncts().stream()
				.map(Phrase::getComponent)
				.collect(Collectors.toList());
	}

	/**
	 * Takes role, sub tokens, slots and attributes of a more recent instance for the same head token.
	 * Only slots declared by this component are updated.
	 */
	@Override
	public void updateFrom(Component other)
	{
		if (other == this)
			return;
		role = other.role;
		sub = new ArrayList<>(other.sub);
		for (String name : specs.keySet())
			setSlot(name, other.getSlot(name));
		other.attributes.forEach((name, value) ->
		{
			if (getType().getAttributeNames().contains(name))
				attributes.put(name, value);
		});
	}

	public JSONObject toData()
	{
		final JSONObject data = new JSONObject();
		data.put("@class", getType().getAlias());
		data.put("tok", getIndex());
		if (role != getType().getRole())
			data.put("role", role.getName());
		if (!sub.isEmpty())
			data.put("sub", indices(sub));
		specs.values().stream()
				.filter(s -> slots.containsKey(s.getName()))
				.forEach(s ->
				{
					final List<Token> tokens = slots.get(s.getName());
					if (s.isMulti())
						data.put(s.getName(), indices(tokens));
					else
						data.put(s.getName(), tokens.get(0).getIndex());
				});
		attributes.forEach((k, v) -> data.put(k, v.name().toLowerCase()));
		return data;
	}

	/**
	 * Reads a component record and registers it in the sentence.
	 * Slots not declared by the component type are declared from the record, as single-valued for
	 * integer values and multi-valued for arrays.
	 */
	public static Component fromData(Sentence sentence, JSONObject data)
	{
		final Document doc = sentence.getSpan().getDocument();
		final ComponentType type = ComponentType.fromAlias(data.getString("@class"));
		final Token tok = doc.get(data.getInt("tok"));
		final Role role = data.has("role") ? Role.fromName(data.getString("role")) : type.getRole();
		final Component comp = type.create(sentence, tok, role, type.getSlots());

		for (String key : new TreeSet<>(data.keySet()))
		{
			if (key.equals("@class") || key.equals("tok") || key.equals("role"))
				continue;
			final Object value = data.get(key);
			if (key.equals("sub"))
				comp.setSub(tokens(doc, data.getJSONArray(key)));
			else if (type.getAttributeNames().contains(key))
				comp.setAttribute(key, type.parseAttribute(key, data.getString(key)));
			else if (value instanceof JSONArray)
			{
				if (!comp.hasSlot(key))
					comp.declare(SlotSpec.multi(key));
				comp.setSlot(key, tokens(doc, (JSONArray) value));
			}
			else if (value instanceof Number)
			{
				if (!comp.hasSlot(key))
					comp.declare(SlotSpec.single(key));
				comp.setSlot(key, ImmutableList.of(doc.get(((Number) value).intValue())));
			}
			else
				throw new IllegalArgumentException("Invalid value for slot " + key + ": " + value);
		}

		return sentence.addComponent(comp);
	}

	private static JSONArray indices(List<Token> tokens)
	{
		return new JSONArray(tokens.stream().map(Token::getIndex).collect(Collectors.toList()));
	}

	private static List<Token> tokens(Document doc, JSONArray indices)
	{
		final List<Token> tokens = new ArrayList<>();
		for (int i = 0; i < indices.length(); ++i)
			tokens.add(doc.get(indices.getInt(i)));
		return tokens;
	}

	private static List<Integer> indexList(Collection<Token> tokens)
	{
		return tokens.stream().map(Token::getIndex).collect(Collectors.toList());
	}

	@Override
	public int compareTo(Component o) { return Integer.compare(getIndex(), o.getIndex()); }

	/**
	 * Structural equality: same type, head, role, sub tokens, slots and attributes.
	 * Tokens are compared by index so that components over equal documents compare equal.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Component other = (Component) o;
		if (getIndex() != other.getIndex() || role != other.role || !attributes.equals(other.attributes))
			return false;
		if (!indexList(sub).equals(indexList(other.sub)) || !slots.keySet().equals(other.slots.keySet()))
			return false;
		return slots.keySet().stream()
				.allMatch(k -> indexList(slots.get(k)).equals(indexList(other.slots.get(k))));
	}

	@Override
	public int hashCode() { return Objects.hash(getClass(), getIndex()); }

	@Override
	public String toString()
	{
		return getTokens().stream()
				.map(Token::getText)
				.collect(Collectors.joining(" "));
	}
}
