package taxon;

/**
 * A leaf of an input tree: a sequenced strain or sample.
 *
 * Labels are normalized once, when the taxon is created from the raw text of
 * a tree file, so that "X" and "X " name the same taxon everywhere else.
 */
public class Taxon {

    public final int id;
    public final String label;

    public Taxon(int i, String lb){
        id = i;
        label = normalizeLabel(lb);
    }

    /**
     * Strips trailing whitespace from a raw leaf label.
     */
    public static String normalizeLabel(String raw){
        if(raw == null){
            throw new IllegalArgumentException("Taxon label must not be null");
        }
        return raw.stripTrailing();
    }

    @Override
    public String toString(){
        return label;
    }
}
