package in.co.vedicwisdom.pojos;

public class RequestBody {
    private String function;
    private String weekStart; // yyyy-MM-dd, defaults to today at the configured location
    private String date;
    private String format; // "json" (default) or "text"

    public String getFunction() {
        return function;
    }

    public void setFunction(String function) {
        this.function = function;
    }

    public String getWeekStart() {
        return weekStart;
    }

    public void setWeekStart(String weekStart) {
        this.weekStart = weekStart;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }
}
