package edu.upf.taln.phrasegraph.core.tokens;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.upf.taln.phrasegraph.core.utils.POS;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Annotations of a single token as produced by an external tagger and parser.
 * Heads and coreferences are document-level token indices; a root token is its own head.
 */
public final class TokenData
{
	private final String text;
	private final String whitespace;
	private final String lemma;
	private final POS.Tag pos;
	private final String tag; // fine-grained tag
	private final String dep; // dependency label
	private final int head;
	private final ImmutableMap<String, ImmutableList<String>> morph;
	private final String ent;
	private final ImmutableList<Integer> corefs;

	public TokenData(String text, String whitespace, String lemma, POS.Tag pos, String tag, String dep, int head,
	                 Map<String, ? extends List<String>> morph, String ent, List<Integer> corefs)
	{
		this.text = Objects.requireNonNull(text);
		this.whitespace = whitespace == null ? "" : whitespace;
		this.lemma = lemma;
		this.pos = pos == null ? POS.Tag.X : pos;
		this.tag = tag == null ? "" : tag;
		this.dep = dep == null ? "" : dep;
		this.head = head;
		ImmutableMap.Builder<String, ImmutableList<String>> builder = ImmutableMap.builder();
		if (morph != null)
			morph.forEach((k, v) -> builder.put(k, ImmutableList.copyOf(v)));
		this.morph = builder.build();
		this.ent = ent == null ? "" : ent;
		this.corefs = corefs == null ? ImmutableList.of() : ImmutableList.copyOf(corefs);
	}

	public TokenData(String text, String whitespace, String lemma, POS.Tag pos, String dep, int head)
	{
		this(text, whitespace, lemma, pos, null, dep, head, null, null, null);
	}

	public String getText() { return text; }
	public String getWhitespace() { return whitespace; }
	public String getLemma() { return lemma; }
	public POS.Tag getPOS() { return pos; }
	public String getTag() { return tag; }
	public String getDep() { return dep; }
	public int getHead() { return head; }
	public Map<String, ImmutableList<String>> getMorph() { return morph; }
	public String getEnt() { return ent; }
	public List<Integer> getCorefs() { return corefs; }

	public JSONObject toData()
	{
		JSONObject data = new JSONObject();
		data.put("text", text);
		data.put("ws", whitespace);
		if (lemma != null)
			data.put("lemma", lemma);
		data.put("pos", pos.name());
		data.put("tag", tag);
		data.put("dep", dep);
		data.put("head", head);
		if (!morph.isEmpty())
		{
			JSONObject feats = new JSONObject();
			morph.forEach((k, v) -> feats.put(k, new JSONArray(v)));
			data.put("morph", feats);
		}
		if (!ent.isEmpty())
			data.put("ent", ent);
		if (!corefs.isEmpty())
			data.put("corefs", new JSONArray(corefs));
		return data;
	}

	public static TokenData fromData(JSONObject data)
	{
		ImmutableMap.Builder<String, List<String>> morph = ImmutableMap.builder();
		JSONObject feats = data.optJSONObject("morph");
		if (feats != null)
		{
			for (String key : feats.keySet())
			{
				JSONArray values = feats.getJSONArray(key);
				ImmutableList.Builder<String> list = ImmutableList.builder();
				for (int i = 0; i < values.length(); ++i)
					list.add(values.getString(i));
				morph.put(key, list.build());
			}
		}

		ImmutableList.Builder<Integer> corefs = ImmutableList.builder();
		JSONArray refs = data.optJSONArray("corefs");
		if (refs != null)
		{
			for (int i = 0; i < refs.length(); ++i)
				corefs.add(refs.getInt(i));
		}

		return new TokenData(data.getString("text"), data.optString("ws", ""),
				data.has("lemma") ? data.getString("lemma") : null,
				POS.get(data.getString("pos"), POS.Tagset.UD), data.optString("tag", ""),
				data.getString("dep"), data.getInt("head"), morph.build(), data.optString("ent", ""),
				corefs.build());
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		TokenData other = (TokenData) o;
		return head == other.head && text.equals(other.text) && whitespace.equals(other.whitespace) &&
				Objects.equals(lemma, other.lemma) && pos == other.pos && tag.equals(other.tag) &&
				dep.equals(other.dep) && morph.equals(other.morph) && ent.equals(other.ent) &&
				corefs.equals(other.corefs);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(text, pos, dep, head);
	}

	@Override
	public String toString() { return text; }
}
